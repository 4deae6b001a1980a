package com.catagent.security;

import java.time.Instant;

public record RateLimitStatus(int limit, int remaining, Instant resetAt) {}
