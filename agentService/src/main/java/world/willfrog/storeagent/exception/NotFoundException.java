package world.willfrog.storeagent.exception;

import world.willfrog.storeagent.common.dto.ResponseCode;

public class NotFoundException extends StoreAgentException {

    public NotFoundException(String message) {
        super(ResponseCode.DATA_NOT_FOUND, message);
    }

    public static NotFoundException agent(String slug) {
        return new NotFoundException("agent not registered: " + slug);
    }

    public static NotFoundException actionType(String type) {
        return new NotFoundException("action type not registered: " + type);
    }
}
