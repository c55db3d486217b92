package com.capreg.plugin;

/**
 * The module does not expose a usable registration hook: no service entry, no provider, or a provider
 * that is missing, does not implement {@link RegistrationHook}, or cannot be instantiated.
 */
public final class PluginContractException extends PluginException {

    public PluginContractException(String module, String message) {
        this(module, message, null);
    }

    public PluginContractException(String module, String message, Throwable cause) {
        super(module, message, cause);
    }

    @Override
    public String getKind() {
        return "contract_error";
    }
}
