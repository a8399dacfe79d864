package io.guildflow.platform;

public record PlatformResult<T>(Status status, T value, String detail) {
    public enum Status {
        OK,
        NOT_FOUND,
        FORBIDDEN,
        FAILED
    }

    public static <T> PlatformResult<T> ok(T value) {
        return new PlatformResult<>(Status.OK, value, null);
    }

    public static PlatformResult<Void> done() {
        return new PlatformResult<>(Status.OK, null, null);
    }

    public static <T> PlatformResult<T> notFound(String detail) {
        return new PlatformResult<>(Status.NOT_FOUND, null, detail);
    }

    public static <T> PlatformResult<T> forbidden(String detail) {
        return new PlatformResult<>(Status.FORBIDDEN, null, detail);
    }

    public static <T> PlatformResult<T> failed(String detail) {
        return new PlatformResult<>(Status.FAILED, null, detail);
    }

    public boolean isOk() {
        return status == Status.OK;
    }
}
