package com.fhi.model_builder.exception;

/**
 * Exception thrown when a model builder is misconfigured or misused.
 *
 * <p>Use static factory methods to build a meaningful {@code ModelBuilderException}
 * with a specific cause enum and a descriptive message.</p>
 *
 * <p>All causes are programming errors in a fixture definition or in the test using it.
 * They are raised at the call site that triggers them and are never retried.</p>
 */
public class ModelBuilderException extends RuntimeException
{
    /**
     * Enum representing the specific reason why the builder failed.
     */
   public enum Cause
   {
      UNIMPLEMENTED_DEFAULTS("Builder %s must override getDefaultFields() to set required fields on %s"),
      UNIMPLEMENTED_MODEL   ("Builder %s has no model class: pass one to the constructor or override getModel()"),
      FIELD_NOT_FOUND       ("Field '%s' does not exist on model %s (known fields: %s)"),
      INVALID_SETTER_NAME   ("'%s' is not a setter: dynamic setters must start with '%s'"),
      SETTER_INVOCATION     ("Could not invoke setter '%s' on %s");

      private final String messageTemplate;

      Cause(String messageTemplate)
      {  this.messageTemplate = messageTemplate;
      }

      public String format(Object... args)
      {  return String.format(messageTemplate, args);
      }
   }

   private final Cause causeEnum;

   /**
    * @param causeEnum a semantic reason from the {@code Cause} enum
    * @param message a human-readable description of the failure
    */
   public ModelBuilderException(Cause causeEnum, String message)
   {  this(causeEnum, message, null);
   }

    /**
     * @param causeEnum a semantic reason from the {@code Cause} enum
     * @param message a human-readable description
     * @param cause the original exception that triggered this one
     */
    public ModelBuilderException(Cause causeEnum, String message, Throwable cause)
    {   super(message, cause);
        this.causeEnum = causeEnum;
    }

    /**
     * Returns the reason for the failure.
     */
    public Cause getCauseEnum()
    {   return causeEnum;
    }


   /**
    * Format:
    * <pre>
    * ModelBuilderException: Main error message | Caused by: CauseClass: Cause message
    * </pre>
    */
   @Override
   public String toString()
   {
      String errMsg = String.format("%s: %s", this.getClass().getSimpleName(), this.getMessage());

      Throwable cause = getCause();
      if (     cause != null && cause.getMessage() != null
            && !cause.getMessage().isBlank())
      {  errMsg += String.format(" | Caused by: %s: %s", cause.getClass().getSimpleName(), cause.getMessage());
      }
      return errMsg;
   }



    // -----------------------------------------
    // Static factory methods
    // -----------------------------------------

   public static ModelBuilderException unimplementedDefaults(Class<?> builderType, Class<?> modelType)
   {  return new ModelBuilderException(Cause.UNIMPLEMENTED_DEFAULTS,
                                      Cause.UNIMPLEMENTED_DEFAULTS.format(builderType.getSimpleName(),
                                                                          modelType == null ? "its model" : modelType.getSimpleName()));
   }

    public static ModelBuilderException unimplementedModel(Class<?> builderType)
    {   return new ModelBuilderException(Cause.UNIMPLEMENTED_MODEL,
                                         Cause.UNIMPLEMENTED_MODEL.format(builderType.getSimpleName()));
    }

    public static ModelBuilderException fieldNotFound(String field, Class<?> modelType, Object knownFields)
    {   return new ModelBuilderException(Cause.FIELD_NOT_FOUND,
                                         Cause.FIELD_NOT_FOUND.format(field, modelType.getSimpleName(), knownFields));
    }

    public static ModelBuilderException invalidSetterName(String name, String prefix)
    {   return new ModelBuilderException(Cause.INVALID_SETTER_NAME,
                                         Cause.INVALID_SETTER_NAME.format(name, prefix));
    }

    /**
     * @param cause pass null if no Throwable cause.
     */
    public static ModelBuilderException setterInvocation(String name, Class<?> builderType, Throwable cause)
    {   return new ModelBuilderException(Cause.SETTER_INVOCATION,
                                         Cause.SETTER_INVOCATION.format(name, builderType.getSimpleName()),
                                         cause);
    }
}
