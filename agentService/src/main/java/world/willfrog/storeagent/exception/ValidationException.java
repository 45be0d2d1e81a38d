package world.willfrog.storeagent.exception;

import world.willfrog.storeagent.common.dto.ResponseCode;

public class ValidationException extends StoreAgentException {

    public ValidationException(String message) {
        super(ResponseCode.PARAM_ERROR, message);
    }
}
