package com.catagent.shared.model;

public record UserStatus(boolean hasOwnKey, long freeQuotaRemaining, int freeQuotaDaily) {}
