package com.jalarm.error;

/**
 * Base type for every error the scheduler reports to callers. Validation kinds are
 * thrown before any write, so a rejected call leaves stored state unchanged.
 * {@link DeliveryFailureException} only travels between a delivery channel and the
 * dispatcher, which records it instead of rethrowing.
 */
public abstract class SchedulingException extends RuntimeException {

    protected SchedulingException(String message) {
        super(message);
    }

    protected SchedulingException(String message, Throwable cause) {
        super(message, cause);
    }

    public static class DuplicateIdException extends SchedulingException {
        private final String itemId;

        public DuplicateIdException(String itemId) {
            super("Reminder " + itemId + " already exists");
            this.itemId = itemId;
        }

        public String getItemId() { return itemId; }
    }

    public static class NotFoundException extends SchedulingException {
        private final String itemId;

        public NotFoundException(String kind, String itemId) {
            super(kind + " " + itemId + " not found");
            this.itemId = itemId;
        }

        public String getItemId() { return itemId; }
    }

    public static class InvalidTransitionException extends SchedulingException {
        private final String itemId;

        public InvalidTransitionException(String itemId, String from, String to) {
            super("Reminder " + itemId + " is already " + from + ", cannot move to " + to);
            this.itemId = itemId;
        }

        public String getItemId() { return itemId; }
    }

    public static class PastTriggerTimeException extends SchedulingException {
        public PastTriggerTimeException(String itemId) {
            super("Trigger time of reminder " + itemId + " must be in the future");
        }
    }

    public static class InvalidCronExpressionException extends SchedulingException {
        private final String expression;

        public InvalidCronExpressionException(String expression, String reason) {
            super("Invalid cron expression '" + expression + "': " + reason);
            this.expression = expression;
        }

        public InvalidCronExpressionException(String expression, String reason, Throwable cause) {
            super("Invalid cron expression '" + expression + "': " + reason, cause);
            this.expression = expression;
        }

        public String getExpression() { return expression; }
    }

    public static class DeliveryFailureException extends SchedulingException {
        public DeliveryFailureException(String message) {
            super(message);
        }

        public DeliveryFailureException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
