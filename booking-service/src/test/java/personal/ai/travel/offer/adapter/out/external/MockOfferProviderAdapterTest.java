package personal.ai.travel.offer.adapter.out.external;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import personal.ai.travel.offer.domain.model.Offer;
import personal.ai.travel.offer.domain.model.OfferSearchCriteria;
import personal.ai.travel.offer.domain.model.OfferValidation;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("MockOfferProviderAdapter 단위 테스트")
class MockOfferProviderAdapterTest {

    private final MockOfferProviderAdapter adapter = new MockOfferProviderAdapter("EUR");

    @Test
    @DisplayName("검색된 상품은 같은 가격으로 검증된다")
    void searchAndValidate_AgreeOnPrice() {
        // given
        OfferSearchCriteria criteria = new OfferSearchCriteria("TLV", "PAR", LocalDate.of(2026, 12, 1), null, 1, null);

        // when
        List<Offer> offers = adapter.searchOffers(criteria);

        // then
        assertThat(offers).hasSize(10);
        Offer first = offers.get(0);
        assertThat(first.offerId()).isEqualTo("TLV-PAR-20261201-0");
        OfferValidation validation = adapter.validateOffer(first.offerId());
        assertThat(validation.valid()).isTrue();
        assertThat(validation.price()).isEqualByComparingTo(first.price());
        assertThat(validation.currency()).isEqualTo("EUR");
        assertThat(validation.capacity()).isEqualTo(9);
    }

    @Test
    @DisplayName("형식에 맞지 않는 상품 ID는 유효하지 않다")
    void validate_MalformedId() {
        assertThat(adapter.validateOffer("not-an-offer").valid()).isFalse();
        assertThat(adapter.validateOffer(null).valid()).isFalse();
    }
}
