package com.jreinhal.bastion.budget;

public record UsageStats(long globalToday, long globalLimit, long ipLimit) {
}
