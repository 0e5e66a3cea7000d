package personal.ai.travel.booking.adapter.in.web;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import personal.ai.common.dto.ApiResponse;
import personal.ai.travel.booking.adapter.in.web.dto.BookingResponse;
import personal.ai.travel.booking.adapter.in.web.dto.EventPageResponse;
import personal.ai.travel.booking.adapter.in.web.dto.StoredEventResponse;
import personal.ai.travel.booking.application.port.in.RebuildReadModelUseCase;
import personal.ai.travel.booking.application.port.in.RebuildReport;
import personal.ai.travel.eventstore.application.port.in.ExportEventsUseCase;

import java.time.Instant;
import java.util.List;

/**
 * Read Model Admin API Controller
 * 조회 모델 재구성, 이벤트 감사 조회, 취소 행 정리
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/admin")
@RequiredArgsConstructor
public class ReadModelAdminController {

    private final RebuildReadModelUseCase rebuildReadModelUseCase;
    private final ExportEventsUseCase exportEventsUseCase;

    /**
     * 전체 조회 모델 재구성
     * POST /api/v1/admin/read-model/rebuild
     */
    @PostMapping("/read-model/rebuild")
    public ResponseEntity<ApiResponse<RebuildReport>> rebuildAll() {
        log.info("Rebuild all read model rows requested");

        RebuildReport report = rebuildReadModelUseCase.rebuildAll();

        if (report.hasFailures()) {
            return ResponseEntity.ok(ApiResponse.error("Rebuild finished with failures", report));
        }
        return ResponseEntity.ok(ApiResponse.success("Rebuilt " + report.rebuilt() + " aggregates", report));
    }

    /**
     * aggregate 하나 재구성
     * POST /api/v1/admin/read-model/rebuild/{aggregateId}
     */
    @PostMapping("/read-model/rebuild/{aggregateId}")
    public ResponseEntity<ApiResponse<BookingResponse>> rebuild(@PathVariable String aggregateId) {
        BookingResponse response = BookingResponse.from(rebuildReadModelUseCase.rebuildReadModel(aggregateId));
        return ResponseEntity.ok(ApiResponse.success("Read model rebuilt", response));
    }

    /**
     * 전체 이벤트 페이지 조회
     * GET /api/v1/admin/events?fromOffset=1&limit=100
     */
    @GetMapping("/events")
    public ResponseEntity<ApiResponse<EventPageResponse>> exportEvents(
            @RequestParam(defaultValue = "0") long fromOffset,
            @RequestParam(defaultValue = "100") int limit
    ) {
        EventPageResponse response = EventPageResponse.from(exportEventsUseCase.exportEvents(fromOffset, limit));
        return ResponseEntity.ok(ApiResponse.success("Events exported: " + response.events().size(), response));
    }

    /**
     * aggregate 이벤트 이력 조회
     * GET /api/v1/admin/events/{aggregateId}
     */
    @GetMapping("/events/{aggregateId}")
    public ResponseEntity<ApiResponse<List<StoredEventResponse>>> getEventStream(@PathVariable String aggregateId) {
        List<StoredEventResponse> response = exportEventsUseCase.getEventStream(aggregateId).stream()
                .map(StoredEventResponse::from)
                .toList();
        return ResponseEntity.ok(ApiResponse.success("Event stream found: " + response.size(), response));
    }

    /**
     * 기준 시각 이전에 취소된 조회 모델 행 삭제
     * DELETE /api/v1/admin/read-model/cancelled?before=2026-01-01T00:00:00Z
     */
    @DeleteMapping("/read-model/cancelled")
    public ResponseEntity<ApiResponse<Integer>> pruneCancelled(
            @RequestParam Instant before
    ) {
        log.info("Prune cancelled read model rows requested: before={}", before);

        int deleted = rebuildReadModelUseCase.pruneCancelledBefore(before);

        return ResponseEntity.ok(ApiResponse.success("Pruned " + deleted + " cancelled bookings", deleted));
    }
}
