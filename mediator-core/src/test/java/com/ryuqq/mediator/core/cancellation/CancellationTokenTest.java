package com.ryuqq.mediator.core.cancellation;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CancellationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * CancellationToken 유닛 테스트.
 *
 * @author Mediator Team
 * @since 1.0.0
 */
class CancellationTokenTest {

    @Test
    void create_초기_상태는_취소되지_않음() {
        CancellationToken token = CancellationToken.create();

        assertThat(token.isCancellationRequested()).isFalse();
        assertThatCode(token::throwIfCancellationRequested).doesNotThrowAnyException();
    }

    @Test
    void cancel_이후_throwIfCancellationRequested는_예외() {
        // given
        CancellationToken token = CancellationToken.create();

        // when
        token.cancel();

        // then
        assertThat(token.isCancellationRequested()).isTrue();
        assertThatThrownBy(token::throwIfCancellationRequested)
            .isInstanceOf(CancellationException.class);
    }

    @Test
    void cancel_중복_호출은_무시() {
        // given
        CancellationToken token = CancellationToken.create();
        token.cancel();

        // when & then
        assertThatCode(token::cancel).doesNotThrowAnyException();
        assertThat(token.isCancellationRequested()).isTrue();
    }

    @Test
    void cancel_다른_스레드의_취소가_관찰됨() throws InterruptedException {
        // given
        CancellationToken token = CancellationToken.create();
        Thread canceller = new Thread(token::cancel);

        // when
        canceller.start();
        canceller.join();

        // then
        assertThat(token.isCancellationRequested()).isTrue();
    }

    @Test
    void none_취소_불가() {
        CancellationToken none = CancellationToken.none();

        assertThat(none).isSameAs(CancellationToken.none());
        assertThatThrownBy(none::cancel).isInstanceOf(UnsupportedOperationException.class);
        assertThat(none.isCancellationRequested()).isFalse();
    }
}
