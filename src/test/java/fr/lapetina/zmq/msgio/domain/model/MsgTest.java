package fr.lapetina.zmq.msgio.domain.model;

import fr.lapetina.zmq.msgio.domain.exception.MsgIoException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class MsgTest {

    @Test
    @DisplayName("should expose frames as strings")
    void shouldExposeFramesAsStrings() {
        Msg msg = Msg.ofStrings("topic", "payload");

        assertThat(msg.frameCount()).isEqualTo(2);
        assertThat(msg.string()).isEqualTo("topic");
        assertThat(msg.strings()).containsExactly("topic", "payload");
        assertThat(msg.isFailed()).isFalse();
        assertThat(msg.error()).isNull();
    }

    @Test
    @DisplayName("should copy frames on the way in and out")
    void shouldCopyFrames() {
        byte[] raw = "abc".getBytes(StandardCharsets.UTF_8);
        Msg msg = Msg.of(raw);

        raw[0] = 'z';
        msg.frame(0)[1] = 'z';
        msg.frames().get(0)[2] = 'z';

        assertThat(msg.string()).isEqualTo("abc");
    }

    @Test
    @DisplayName("should compare by frame content")
    void shouldCompareByContent() {
        assertThat(Msg.ofStrings("a", "b")).isEqualTo(Msg.of("a".getBytes(), "b".getBytes()));
        assertThat(Msg.ofStrings("a", "b")).hasSameHashCodeAs(Msg.ofStrings("a", "b"));
        assertThat(Msg.ofStrings("a", "b")).isNotEqualTo(Msg.ofStrings("a"));
    }

    @Test
    @DisplayName("should carry a failure without frames")
    void shouldCarryFailure() {
        MsgIoException error = new MsgIoException(ErrorType.CONNECTION_ERROR, "boom");
        Msg msg = Msg.failed(error);

        assertThat(msg.isFailed()).isTrue();
        assertThat(msg.error()).isSameAs(error);
        assertThat(msg.frameCount()).isZero();
        assertThat(msg.string()).isEmpty();
        assertThat(msg).isNotEqualTo(Msg.empty());
    }
}
