package com.capreg.plugin;

/** A registration hook ran and threw. Registrations it made before failing stay in the catalog. */
public final class PluginRegistrationException extends PluginException {

    private final String hookName;

    public PluginRegistrationException(String module, String hookName, Throwable cause) {
        super(module, "registration hook " + hookName + " failed: " + cause.getMessage(), cause);
        this.hookName = hookName;
    }

    public String getHookName() {
        return hookName;
    }

    @Override
    public String getKind() {
        return "registration_error";
    }
}
