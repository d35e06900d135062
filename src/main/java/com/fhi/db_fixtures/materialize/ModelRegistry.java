package com.fhi.db_fixtures.materialize;

import java.lang.annotation.Annotation;
import java.lang.reflect.AnnotatedElement;
import java.lang.reflect.Member;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.beans.BeanUtils;
import org.springframework.util.ClassUtils;

import jakarta.persistence.GeneratedValue;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.metamodel.EntityType;
import jakarta.persistence.metamodel.Metamodel;
import jakarta.persistence.metamodel.SingularAttribute;
import lombok.extern.slf4j.Slf4j;


/**
 * Maps the model names used in fixture files to {@link ModelType}s.
 *
 * <p>{@link #fromMetamodel(Metamodel)} registers every JPA entity twice: under its fully-qualified
 * class name ({@code com.example.model.Book}) and under its entity name ({@code Book}). Further
 * names can be added with {@link #register(String, ModelType)}, e.g. to keep old fixture files
 * working after an entity moved package.</p>
 *
 * <p>The registry is populated once, when the application context starts; it does not scan the
 * classpath at load time.</p>
 */
@Slf4j
public class ModelRegistry
{
    private final Map<String, ModelType> types = new ConcurrentHashMap<>();


    /**
     * Builds a registry holding every entity of the given JPA metamodel.
     */
    public static ModelRegistry fromMetamodel(Metamodel metamodel)
    {
        Map<Class<?>, EntityType<?>> entitiesByClass = new HashMap<>();
        for (EntityType<?> entity : metamodel.getEntities())
        {   Class<?> javaType = entity.getJavaType();
            if (javaType != null && !Map.class.isAssignableFrom(javaType))   // skip dynamic-map entities
            {   entitiesByClass.put(javaType, entity);
            }
        }

        ModelRegistry registry = new ModelRegistry();
        for (EntityType<?> entity : entitiesByClass.values())
        {   registry.register(describe(entity, entitiesByClass));
        }
        log.debug("Model registry initialised with {} entity type(s): {}", entitiesByClass.size(), registry.names());
        return registry;
    }


    /**
     * Registers {@code type} under its qualified class name and its entity name.
     */
    public void register(ModelType type)
    {   register(type.getJavaType().getName(), type);
        register(type.getEntityName(), type);
    }


    public void register(String name, ModelType type)
    {   ModelType previous = types.put(name, type);
        if (previous != null && previous != type)
        {   log.warn("Model name '{}' re-registered: {} replaces {}", name, type.getJavaType().getName(),
                     previous.getJavaType().getName());
        }
    }


    public Optional<ModelType> resolve(String name)
    {   return Optional.ofNullable(types.get(name));
    }


    public Set<String> names()
    {   return Collections.unmodifiableSet(new TreeSet<>(types.keySet()));
    }


    private static ModelType describe(EntityType<?> entity, Map<Class<?>, EntityType<?>> entitiesByClass)
    {
        Class<?> javaType = entity.getJavaType();
        SingularAttribute<?, ?> id = idAttribute(entity);

        List<ModelType.Association> associations = new ArrayList<>();
        for (SingularAttribute<?, ?> attribute : entity.getSingularAttributes())
        {
            if (!attribute.isAssociation()) continue;

            EntityType<?> target = entitiesByClass.get(attribute.getJavaType());
            SingularAttribute<?, ?> targetId = target == null ? null : idAttribute(target);
            if (targetId == null) continue;   // composite or unknown target: only settable by attribute

            associations.add(new ModelType.Association(
                    attribute.getName(),
                    joinColumnName(attribute, targetId.getName()),
                    target.getJavaType(),
                    ClassUtils.resolvePrimitiveIfNecessary(targetId.getJavaType())));
        }

        return new ModelType(entity.getName(),
                             javaType,
                             () -> BeanUtils.instantiateClass(javaType),
                             id == null ? null : id.getName(),
                             id != null && isAnnotated(id, GeneratedValue.class),
                             associations);
    }


    private static SingularAttribute<?, ?> idAttribute(EntityType<?> entity)
    {   if (!entity.hasSingleIdAttribute()) return null;
        for (SingularAttribute<?, ?> attribute : entity.getSingularAttributes())
        {   if (attribute.isId()) return attribute;
        }
        return null;
    }


    /**
     * {@code @JoinColumn(name)} when declared, otherwise the JPA default
     * {@code <attribute>_<referenced id>}.
     */
    private static String joinColumnName(SingularAttribute<?, ?> attribute, String targetIdName)
    {
        JoinColumn joinColumn = annotation(attribute, JoinColumn.class);
        if (joinColumn != null && !joinColumn.name().isBlank())
        {   return joinColumn.name();
        }
        return attribute.getName() + "_" + targetIdName;
    }


    private static boolean isAnnotated(SingularAttribute<?, ?> attribute, Class<? extends Annotation> annotationType)
    {   return annotation(attribute, annotationType) != null;
    }


    private static <A extends Annotation> A annotation(SingularAttribute<?, ?> attribute, Class<A> annotationType)
    {   Member member = attribute.getJavaMember();
        return member instanceof AnnotatedElement ? ((AnnotatedElement) member).getAnnotation(annotationType) : null;
    }
}
