package com.umitunal.leaseq.support;

import com.umitunal.leaseq.core.QueueErrorKind;
import com.umitunal.leaseq.core.QueueException;
import org.assertj.core.api.ThrowableAssert;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public final class QueueAssertions {

    private QueueAssertions() {
    }

    public static void assertQueueError(ThrowableAssert.ThrowingCallable call, QueueErrorKind kind) {
        assertThatThrownBy(call)
                .isInstanceOfSatisfying(QueueException.class, e -> assertThat(e.getKind()).isEqualTo(kind));
    }
}
