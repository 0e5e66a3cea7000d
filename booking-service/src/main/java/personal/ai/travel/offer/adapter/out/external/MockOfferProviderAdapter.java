package personal.ai.travel.offer.adapter.out.external;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import personal.ai.travel.offer.application.port.out.OfferProvider;
import personal.ai.travel.offer.domain.model.Offer;
import personal.ai.travel.offer.domain.model.OfferSearchCriteria;
import personal.ai.travel.offer.domain.model.OfferValidation;

import java.math.BigDecimal;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import java.util.regex.Pattern;

/**
 * Mock Offer Provider Adapter
 * 제공자 API 키 없이 로컬/데모 환경에서 사용하는 결정적(deterministic) 상품 제공자
 *
 * - 상품 ID 형식: {출발지 3자}-{도착지 3자}-{yyyyMMdd}-{순번}
 * - 가격/항공사/소요시간은 상품 ID로 시드를 고정해 검색과 검증 결과가 항상 일치한다
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "external.offer-provider.mode", havingValue = "mock")
public class MockOfferProviderAdapter implements OfferProvider {

    private static final Pattern OFFER_ID_PATTERN = Pattern.compile("^[A-Z]{1,3}-[A-Z]{1,3}-\\d{8}-\\d+$");
    private static final DateTimeFormatter OFFER_DATE = DateTimeFormatter.BASIC_ISO_DATE;
    private static final List<String> AIRLINES =
            List.of("ElAl", "Air France", "Lufthansa", "Ryanair", "Turkish Airlines");
    private static final int OFFERS_PER_SEARCH = 10;
    private static final int BASE_PRICE = 300;
    private static final int MIN_PRICE = 50;
    private static final int SEATS_PER_OFFER = 9;

    private final String currency;

    public MockOfferProviderAdapter(@Value("${booking.currency:EUR}") String currency) {
        this.currency = currency;
    }

    @Override
    public OfferValidation validateOffer(String offerId) {
        if (offerId == null || !OFFER_ID_PATTERN.matcher(offerId).matches()) {
            log.debug("Mock offer rejected: offerId={}", offerId);
            return OfferValidation.unavailable(offerId);
        }
        return new OfferValidation(offerId, true, priceOf(offerId), currency, SEATS_PER_OFFER);
    }

    @Override
    public List<Offer> searchOffers(OfferSearchCriteria criteria) {
        String prefix = code(criteria.departure()) + "-" + code(criteria.destination()) + "-"
                + criteria.departDate().format(OFFER_DATE);

        List<Offer> offers = new ArrayList<>(OFFERS_PER_SEARCH);
        for (int i = 0; i < OFFERS_PER_SEARCH; i++) {
            String offerId = prefix + "-" + i;
            Random random = new Random(offerId.hashCode());
            offers.add(new Offer(
                    offerId,
                    criteria.departure(),
                    criteria.destination(),
                    criteria.departDate(),
                    criteria.returnDate(),
                    AIRLINES.get(random.nextInt(AIRLINES.size())),
                    priceOf(offerId),
                    currency,
                    180 + random.nextInt(541),
                    random.nextInt(3),
                    criteria.adults()));
        }
        log.debug("Mock offers generated: prefix={}, count={}", prefix, offers.size());
        return offers;
    }

    private BigDecimal priceOf(String offerId) {
        Random random = new Random(~offerId.hashCode());
        int price = BASE_PRICE + random.nextInt(291) - 40;
        return BigDecimal.valueOf(Math.max(MIN_PRICE, price));
    }

    private String code(String place) {
        String letters = place.replaceAll("[^A-Za-z]", "").toUpperCase(Locale.ROOT);
        if (letters.isEmpty()) {
            return "XXX";
        }
        return letters.substring(0, Math.min(3, letters.length()));
    }
}
