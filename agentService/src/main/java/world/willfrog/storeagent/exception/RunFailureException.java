package world.willfrog.storeagent.exception;

import world.willfrog.storeagent.common.dto.ResponseCode;

/**
 * Aborts a whole run, e.g. when setup data cannot be loaded. Actions already proposed stay valid.
 */
public class RunFailureException extends StoreAgentException {

    public RunFailureException(String message) {
        super(ResponseCode.BUSINESS_ERROR, message);
    }

    public RunFailureException(String message, Throwable cause) {
        super(ResponseCode.BUSINESS_ERROR, message, cause);
    }
}
