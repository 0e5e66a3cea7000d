package personal.ai.travel.offer.adapter.in.web;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import personal.ai.common.dto.ApiResponse;
import personal.ai.travel.offer.adapter.in.web.dto.OfferResponse;
import personal.ai.travel.offer.application.port.in.SearchOffersUseCase;
import personal.ai.travel.offer.domain.model.OfferSearchCriteria;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Offer API Controller
 * 외부 제공자 상품 검색 (읽기 전용 통과 조회)
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class OfferController {

    private final SearchOffersUseCase searchOffersUseCase;

    /**
     * 상품 검색
     * GET /api/v1/offers?departure=TLV&destination=PAR&departDate=2026-12-01&adults=1
     */
    @GetMapping("/offers")
    public ResponseEntity<ApiResponse<List<OfferResponse>>> searchOffers(
            @RequestParam String departure,
            @RequestParam String destination,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate departDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate returnDate,
            @RequestParam(defaultValue = "1") int adults,
            @RequestParam(required = false) BigDecimal maxBudget
    ) {
        log.info("Search offers: departure={}, destination={}, departDate={}, adults={}",
                departure, destination, departDate, adults);

        OfferSearchCriteria criteria = new OfferSearchCriteria(
                departure, destination, departDate, returnDate, adults, maxBudget);

        List<OfferResponse> offers = searchOffersUseCase.searchOffers(criteria).stream()
                .map(OfferResponse::from)
                .toList();

        return ResponseEntity.ok(ApiResponse.success("Offers found: " + offers.size(), offers));
    }
}
