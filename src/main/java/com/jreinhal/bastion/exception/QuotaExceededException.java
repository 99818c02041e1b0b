package com.jreinhal.bastion.exception;

public class QuotaExceededException extends GatewayException {
    public static final long DAILY_RETRY_AFTER_SECONDS = 86400L;
    private final String quotaType;
    private final long limit;

    public QuotaExceededException(String quotaType, long limit, String message) {
        super(ErrorCategory.QUOTA_EXCEEDED, message);
        this.quotaType = quotaType;
        this.limit = limit;
    }

    public String getQuotaType() {
        return this.quotaType;
    }

    public long getLimit() {
        return this.limit;
    }

    @Override
    public Long getRetryAfterSeconds() {
        return DAILY_RETRY_AFTER_SECONDS;
    }
}
