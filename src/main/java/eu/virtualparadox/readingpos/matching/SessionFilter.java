package eu.virtualparadox.readingpos.matching;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Drops sessions that cannot meaningfully own highlights:
 * <ul>
 *   <li>zero-span sessions (same start and end xpoint, same start and end page);</li>
 *   <li>sessions shorter than {@code readingpos.session.minimum-duration}. Sessions without
 *       timestamps are kept.</li>
 * </ul>
 */
@Slf4j
@Component
public class SessionFilter {

    private final Duration minimumDuration;

    public SessionFilter(@Value("${readingpos.session.minimum-duration:PT0S}") final Duration minimumDuration) {
        Objects.requireNonNull(minimumDuration, "minimumDuration must not be null");
        if (minimumDuration.isNegative()) {
            throw new IllegalArgumentException("minimumDuration must not be negative");
        }
        this.minimumDuration = minimumDuration;
    }

    public List<ReadingSession> filter(final List<ReadingSession> sessions) {
        if (sessions == null || sessions.isEmpty()) {
            return new ArrayList<>();
        }

        final List<ReadingSession> kept = new ArrayList<>(sessions.size());
        int zeroSpan = 0;
        int tooShort = 0;
        for (final ReadingSession session : sessions) {
            if (session.isZeroSpan()) {
                zeroSpan++;
                continue;
            }
            final Duration duration = session.duration();
            if (duration != null && duration.compareTo(minimumDuration) < 0) {
                tooShort++;
                continue;
            }
            kept.add(session);
        }

        if (zeroSpan > 0 || tooShort > 0) {
            log.debug("Filtered sessions: {} zero-span, {} below {}", zeroSpan, tooShort, minimumDuration);
        }
        return kept;
    }
}
