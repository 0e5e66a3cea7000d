package personal.ai.travel.booking.application.port.in;

import java.util.List;

/**
 * 전체 재구성 결과
 *
 * @param rebuilt  재구성된 aggregate 수
 * @param failures 재구성에 실패한 aggregate와 원인
 */
public record RebuildReport(
        int rebuilt,
        List<Failure> failures
) {
    public record Failure(String aggregateId, String reason) {
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
