package de.jwiegmann.chunkupload.entity;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UploadSessionStatusTest {

    @Test
    void transitions() {
        assertThat(UploadSessionStatus.PENDING.canTransitionTo(UploadSessionStatus.UPLOADING)).isTrue();
        assertThat(UploadSessionStatus.PENDING.canTransitionTo(UploadSessionStatus.PROCESSING)).isFalse();
        assertThat(UploadSessionStatus.PROCESSING.canTransitionTo(UploadSessionStatus.CANCELLED)).isTrue();
        assertThat(UploadSessionStatus.FAILED.canTransitionTo(UploadSessionStatus.UPLOADING)).isTrue();
        assertThat(UploadSessionStatus.FAILED.canTransitionTo(UploadSessionStatus.COMPLETED)).isTrue();
        assertThat(UploadSessionStatus.UPLOADING.canTransitionTo(UploadSessionStatus.COMPLETED)).isFalse();
        assertThat(UploadSessionStatus.COMPLETED.canTransitionTo(UploadSessionStatus.CANCELLED)).isFalse();
    }

    @Test
    void terminalStates() {
        assertThat(UploadSessionStatus.COMPLETED.isTerminal()).isTrue();
        assertThat(UploadSessionStatus.CANCELLED.isTerminal()).isTrue();
        assertThat(UploadSessionStatus.FAILED.isTerminal()).isFalse();
    }

    @Test
    void externalValue() {
        assertThat(UploadSessionStatus.PROCESSING.value()).isEqualTo("processing");
        assertThat(UploadSessionStatus.fromValue(" Failed ")).isEqualTo(UploadSessionStatus.FAILED);
        assertThatThrownBy(() -> UploadSessionStatus.fromValue("archived")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void progressIsRounded() {
        UploadSession s = UploadSession.builder().totalChunks(3).uploadedChunks(1).build();

        assertThat(s.getProgress()).isEqualTo(33);
        s.setUploadedChunks(2);
        assertThat(s.getProgress()).isEqualTo(67);
    }
}
