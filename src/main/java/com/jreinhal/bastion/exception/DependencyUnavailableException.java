package com.jreinhal.bastion.exception;

public class DependencyUnavailableException extends GatewayException {
    private final String dependency;

    public DependencyUnavailableException(String dependency, Throwable cause) {
        super(ErrorCategory.DEPENDENCY_UNAVAILABLE,
                "Servis geçici olarak erişilemiyor: " + dependency + ". Lütfen tekrar deneyin.", cause);
        this.dependency = dependency;
    }

    public String getDependency() {
        return this.dependency;
    }
}
