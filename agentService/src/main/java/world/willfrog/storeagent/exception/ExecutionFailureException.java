package world.willfrog.storeagent.exception;

import world.willfrog.storeagent.common.dto.ResponseCode;

/**
 * Raised by action handlers when the side effect could not be performed.
 */
public class ExecutionFailureException extends StoreAgentException {

    public ExecutionFailureException(String message) {
        super(ResponseCode.BUSINESS_ERROR, message);
    }

    public ExecutionFailureException(String message, Throwable cause) {
        super(ResponseCode.BUSINESS_ERROR, message, cause);
    }
}
