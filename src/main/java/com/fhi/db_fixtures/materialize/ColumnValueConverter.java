package com.fhi.db_fixtures.materialize;

import java.sql.Date;
import java.sql.Time;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;

/**
 * Converts fixture scalars to JDBC parameter values for a given column type.
 *
 * <p>Fixture files have no date type, so temporal columns receive ISO-8601 strings
 * ({@code 2021-03-04}, {@code 2021-03-04T10:15:30}, {@code 2021-03-04 10:15:30}). Every other
 * value is passed to the driver untouched.</p>
 */
final class ColumnValueConverter
{
    private ColumnValueConverter()
    {}


    /**
     * @throws java.time.format.DateTimeParseException if a temporal column receives a malformed string
     */
    static Object convert(Object value, int sqlType)
    {
        if (!(value instanceof String))
        {   return value;
        }
        String text = ((String) value).trim();

        switch (sqlType)
        {
            case Types.DATE:
                return Date.valueOf(parseDate(text));

            case Types.TIME:
            case Types.TIME_WITH_TIMEZONE:
                return Time.valueOf(LocalTime.parse(text));

            case Types.TIMESTAMP:
                return Timestamp.valueOf(parseDateTime(text));

            case Types.TIMESTAMP_WITH_TIMEZONE:
                return looksOffset(text)
                        ? OffsetDateTime.parse(text.replace(' ', 'T'))
                        : Timestamp.valueOf(parseDateTime(text));

            default:
                return value;
        }
    }


    private static LocalDate parseDate(String text)
    {   return text.length() > 10 ? parseDateTime(text).toLocalDate() : LocalDate.parse(text);
    }


    private static LocalDateTime parseDateTime(String text)
    {   if (text.length() == 10)
        {   return LocalDate.parse(text).atStartOfDay();
        }
        return LocalDateTime.parse(text.replace(' ', 'T'));
    }


    private static boolean looksOffset(String text)
    {   return text.endsWith("Z") || text.matches(".*[+-]\\d{2}:\\d{2}$");
    }
}
