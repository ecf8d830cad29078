package com.retail.herd.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;

/**
 * A bucket that has been rolled past and will never change again.
 *
 * @param index bucket number since the epoch (event time / bucket width)
 * @param start inclusive start of the bucket
 * @param count events counted into the bucket
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SealedBucket(long index, Instant start, long count) {}
