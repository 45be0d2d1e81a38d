package world.willfrog.storeagent.exception;

import world.willfrog.storeagent.common.dto.ResponseCode;

/**
 * Bad registration or an agent reading a config key it never declared. Fatal at boot.
 */
public class ConfigurationException extends StoreAgentException {

    public ConfigurationException(String message) {
        super(ResponseCode.SYSTEM_ERROR, message);
    }
}
