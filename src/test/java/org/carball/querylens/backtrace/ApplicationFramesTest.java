package org.carball.querylens.backtrace;

import org.carball.querylens.model.Frame;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;

public class ApplicationFramesTest {

    @Test
    void shouldMatchRepositoryServiceAndDaoClasses() {
        // Given
        Predicate<Frame> predicate = ApplicationFrames.repositoriesAndServices();

        // Then
        assertThat(predicate.test(frame("com.acme.orders.OrderRepository"))).isTrue();
        assertThat(predicate.test(frame("com.acme.service.Billing"))).isTrue();
        assertThat(predicate.test(frame("com.acme.users.UserDaoImpl"))).isTrue();
        assertThat(predicate.test(frame("com.acme.web.OrderController"))).isFalse();
    }

    @Test
    void shouldSupportCustomRules() {
        assertThat(ApplicationFrames.inPackage("com.acme.").test(frame("com.acme.web.Home"))).isTrue();
        assertThat(ApplicationFrames.inPackage("com.acme.").test(frame("org.other.Home"))).isFalse();
        assertThat(ApplicationFrames.matching(Pattern.compile("Handler$")).test(frame("com.acme.OrderHandler"))).isTrue();
    }

    @Test
    void shouldFindFirstApplicationFrameSkippingUnnamedOnes() {
        // Given
        Frame unnamed = new Frame("native", 0, null, "call");
        Frame controller = frame("com.acme.web.OrderController");
        Frame repository = frame("com.acme.orders.OrderRepository");
        Frame service = frame("com.acme.service.Billing");

        // When
        Optional<Frame> match = ApplicationFrames.firstMatch(List.of(unnamed, controller, repository, service),
                ApplicationFrames.repositoriesAndServices());

        // Then
        assertThat(match).contains(repository);
        assertThat(ApplicationFrames.firstMatch(List.of(controller), ApplicationFrames.repositoriesAndServices()))
                .isEmpty();
        assertThat(ApplicationFrames.firstMatch(null, frame -> true)).isEmpty();
        assertThat(ApplicationFrames.firstMatch(List.of(unnamed), frame -> true)).isEmpty();
    }

    private static Frame frame(String className) {
        return new Frame("X.java", 1, className, "run");
    }
}
