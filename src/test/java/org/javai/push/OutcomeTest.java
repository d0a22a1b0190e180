package org.javai.push;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class OutcomeTest {

    @Test
    void ok_containsValue() {
        Outcome<String> outcome = Outcome.ok("hello");

        assertThat(outcome.isOk()).isTrue();
        assertThat(outcome.isFail()).isFalse();
        assertThat(outcome.failure()).isEmpty();
        assertThat(outcome.getOrThrow()).isEqualTo("hello");
    }

    @Test
    void ok_minimalOk() {
        Outcome<Void> outcome = Outcome.ok();

        assertThat(outcome.isOk()).isTrue();
        assertThat(((Outcome.Ok<Void>) outcome).value()).isNull();
    }

    @Test
    void fail_exposesFailureKind() {
        FailureKind kind = new FailureKind.TimeoutFailure();
        Outcome<String> outcome = Outcome.fail(kind);

        assertThat(outcome.isFail()).isTrue();
        assertThat(outcome.failure()).contains(kind);
        assertThat(((Outcome.Fail<String>) outcome).kind()).isEqualTo(kind);
    }

    @Test
    void fail_getOrThrow_throwsWithRenderedFailure() {
        FailureKind kind = new FailureKind.RemoteRejection(
                DeliveryResponse.rejected(400, null, new ReasonBody("BadTopic")));
        Outcome<String> outcome = Outcome.fail(kind);

        assertThatThrownBy(outcome::getOrThrow)
                .isInstanceOf(PushFailureException.class)
                .hasMessageContaining("(reason: \"BadTopic\")")
                .extracting(e -> ((PushFailureException) e).failure())
                .isEqualTo(kind);
    }

    @Test
    void fail_getOrElse_returnsDefault() {
        Outcome<String> outcome = Outcome.fail(new FailureKind.ConnectionFailure());

        assertThat(outcome.getOrElse("default")).isEqualTo("default");
        assertThat(outcome.getOrElseGet(() -> "computed")).isEqualTo("computed");
    }

    @Test
    void map_transformsOkAndSkipsFail() {
        assertThat(Outcome.ok("abc").map(String::length).getOrThrow()).isEqualTo(3);

        Outcome<Integer> failed = Outcome.<String>fail(new FailureKind.SerializeFailure()).map(String::length);
        assertThat(failed.failure()).contains(new FailureKind.SerializeFailure());
    }

    @Test
    void flatMap_stopsAtFirstFailure() {
        boolean[] called = {false};

        Outcome<String> result = Outcome.<String>fail(new FailureKind.ReadFailure("missing"))
                .flatMap(value -> {
                    called[0] = true;
                    return Outcome.ok(value);
                });

        assertThat(result.isFail()).isTrue();
        assertThat(called[0]).isFalse();
    }

    @Test
    void recover_turnsFailureIntoValue() {
        Outcome<String> recovered = Outcome.<String>fail(new FailureKind.TimeoutFailure())
                .recover(FailureKind::render);

        assertThat(recovered.getOrThrow()).isEqualTo("Timeout in sending a push notification");
    }

    @Test
    void recoverWith_isIgnoredForOk() {
        Outcome<String> outcome = Outcome.ok("value");

        assertThat(outcome.recoverWith(kind -> Outcome.ok("other"))).isSameAs(outcome);
    }
}
