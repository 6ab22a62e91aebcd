package com.phillippitts.enhancer.service.hook;

import com.phillippitts.enhancer.domain.Operation;

import java.time.Instant;

/**
 * One entry of the recent-activity log.
 *
 * @param at        completion time
 * @param requester caller id, {@code "anonymous"} when unknown
 * @param operation operation performed
 * @param success   whether an output was produced
 * @param detail    method used on success, failure reason otherwise
 */
public record Activity(Instant at, String requester, Operation operation, boolean success, String detail) {
}
