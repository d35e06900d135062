package com.fhi.db_fixtures.exception;

/**
 * A model-targeted record group names a type the model registry does not know.
 */
public class ModelNotFoundException extends FixtureException
{
    private final String modelName;

    public ModelNotFoundException(String fixtureName, String modelName)
    {   super(Cause.MODEL_NOT_FOUND, fixtureName, Cause.MODEL_NOT_FOUND.format(fixtureName, modelName), null);
        this.modelName = modelName;
    }

    public String getModelName()
    {   return modelName;
    }
}
