package com.phillippitts.huevoice.service.pipeline;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorKindTest {

    @Test
    void shouldMapEveryKindToItsPolicy() {
        assertThat(ErrorKind.TRANSIENT_PERCEPTION.policy()).isEqualTo(ErrorKind.Policy.LOG_ONLY);
        assertThat(ErrorKind.SERVICE.policy()).isEqualTo(ErrorKind.Policy.COUNT_TOWARD_RESTART);
        assertThat(ErrorKind.DEVICE.policy()).isEqualTo(ErrorKind.Policy.INVALIDATE_CACHE);
        assertThat(ErrorKind.STAGE_FAILURE.policy()).isEqualTo(ErrorKind.Policy.RESTART_PIPELINE);
        assertThat(ErrorKind.FATAL.policy()).isEqualTo(ErrorKind.Policy.TERMINATE);
    }
}
