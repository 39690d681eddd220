package com.xksgroup.hlstranscoder.service.queue;

import com.xksgroup.hlstranscoder.model.dto.JobDescriptor;

/**
 * A descriptor handed to one consumer. {@code receipt} identifies the delivery
 * to {@link WorkQueue#acknowledge(Delivery)}; {@code redelivered} is set when
 * the descriptor comes back after an expired lease.
 */
public record Delivery(JobDescriptor descriptor, String receipt, boolean redelivered) {
}
