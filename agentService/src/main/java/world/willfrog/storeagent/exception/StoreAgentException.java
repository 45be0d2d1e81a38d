package world.willfrog.storeagent.exception;

import world.willfrog.storeagent.common.dto.ResponseCode;
import world.willfrog.storeagent.common.exception.BizException;

/**
 * Root of the engine's error taxonomy.
 */
public abstract class StoreAgentException extends BizException {

    protected StoreAgentException(ResponseCode code, String message) {
        super(code, message);
    }

    protected StoreAgentException(ResponseCode code, String message, Throwable cause) {
        super(code, message, cause);
    }
}
