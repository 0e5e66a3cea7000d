package personal.ai.travel.acceptance.steps;

import io.cucumber.java.en.And;
import io.cucumber.java.en.Given;
import io.cucumber.java.en.Then;
import io.cucumber.java.en.When;
import io.restassured.response.Response;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import personal.ai.travel.acceptance.support.BookingHttpAdapter;
import personal.ai.travel.acceptance.support.BookingTestContext;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Booking Acceptance Test Step Definitions
 * 비즈니스 관점의 자연어로 작성된 시나리오에 매핑
 */
@Slf4j
@RequiredArgsConstructor
public class BookingAcceptanceSteps {

    private static final Long USER_ID = 42L;
    private static final int EXPORT_PAGE_SIZE = 500;

    private final BookingHttpAdapter bookingAdapter;
    private final BookingTestContext context;

    private static LocalDate departDate() {
        return LocalDate.now().plusDays(30);
    }

    // ==========================================
    // Given: 사전 상태
    // ==========================================

    @Given("상품 {string}의 예약이 확정되어 있다")
    public void 상품의_예약이_확정되어_있다(String offerId) {
        log.info(">>> Given: 확정 예약 생성 - offerId={}", offerId);
        상품을_명이_예약한다(offerId, 1);
        assertThat(context.getLastHttpResponse().statusCode()).isEqualTo(201);
    }

    @Given("현재 이벤트 로그의 이벤트 수를 기록한다")
    public void 현재_이벤트_로그의_이벤트_수를_기록한다() {
        context.setEventCountBefore(countEvents());
    }

    // ==========================================
    // When: 사용자 행동
    // ==========================================

    @When("상품 {string}을 {int}명이 예약한다")
    public void 상품을_명이_예약한다(String offerId, Integer passengers) {
        log.info(">>> When: 예약 생성 API 호출 - offerId={}, passengers={}", offerId, passengers);
        Response response = bookingAdapter.createBooking(USER_ID, offerId, departDate(), passengers);
        context.setLastHttpResponse(response);
        if (response.statusCode() == 201) {
            context.setCurrentBookingId(response.jsonPath().getString("data.bookingId"));
            context.setCurrentAggregateId(response.jsonPath().getString("data.aggregateId"));
        }
    }

    @When("버전 {int} 기준으로 예약을 취소한다")
    public void 버전_기준으로_예약을_취소한다(Integer expectedVersion) {
        log.info(">>> When: 예약 취소 API 호출 - expectedVersion={}", expectedVersion);
        context.setLastHttpResponse(
                bookingAdapter.cancelBooking(context.getCurrentBookingId(), expectedVersion.longValue(), "plans changed"));
    }

    @When("{int}개의 요청이 동시에 버전 {int} 기준으로 예약을 취소한다")
    public void 개의_요청이_동시에_버전_기준으로_예약을_취소한다(Integer count, Integer expectedVersion) {
        log.info(">>> When: {}건의 동시 취소", count);
        CountDownLatch start = new CountDownLatch(1);
        String bookingId = context.getCurrentBookingId();

        List<CompletableFuture<Integer>> futures = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            futures.add(CompletableFuture.supplyAsync(() -> {
                try {
                    start.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException(e);
                }
                return bookingAdapter.cancelBooking(bookingId, expectedVersion.longValue(), null).statusCode();
            }));
        }
        start.countDown();

        futures.forEach(future -> context.getConcurrentStatusCodes().add(future.join()));
    }

    @When("조회 모델을 재구성한다")
    public void 조회_모델을_재구성한다() {
        log.info(">>> When: 조회 모델 재구성 API 호출");
        context.setBookingBeforeRebuild(bookingAdapter.getBooking(context.getCurrentBookingId())
                .jsonPath().getString("data"));
        context.setLastHttpResponse(bookingAdapter.rebuild(context.getCurrentAggregateId()));
    }

    // ==========================================
    // Then: 결과 검증
    // ==========================================

    @Then("응답 상태 코드는 {int}이다")
    public void 응답_상태_코드는_이다(Integer status) {
        assertThat(context.getLastHttpResponse().statusCode()).isEqualTo(status);
    }

    @And("에러 코드는 {string}이다")
    public void 에러_코드는_이다(String code) {
        assertThat(context.getLastHttpResponse().jsonPath().getString("code")).isEqualTo(code);
    }

    @And("예약은 버전 {int}의 {string} 상태로 조회된다")
    public void 예약은_버전의_상태로_조회된다(Integer version, String status) {
        Response response = bookingAdapter.getBooking(context.getCurrentBookingId());
        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.jsonPath().getLong("data.lastVersion")).isEqualTo(version.longValue());
        assertThat(response.jsonPath().getString("data.status")).isEqualTo(status);
    }

    @And("예약 가격은 {int}이다")
    public void 예약_가격은_이다(Integer price) {
        Response response = bookingAdapter.getBooking(context.getCurrentBookingId());
        assertThat(new BigDecimal(response.jsonPath().getString("data.price")))
                .isEqualByComparingTo(BigDecimal.valueOf(price));
    }

    @And("이벤트 스트림에는 이벤트가 {int}개 있다")
    public void 이벤트_스트림에는_이벤트가_개_있다(Integer count) {
        Response response = bookingAdapter.getEventStream(context.getCurrentAggregateId());
        assertThat(response.jsonPath().getList("data")).hasSize(count);
    }

    @Then("성공 응답은 {int}개이고 충돌 응답은 {int}개이다")
    public void 성공_응답은_개이고_충돌_응답은_개이다(Integer succeeded, Integer conflicted) {
        List<Integer> codes = context.getConcurrentStatusCodes();
        assertThat(codes).filteredOn(code -> code == 200).hasSize(succeeded);
        assertThat(codes).filteredOn(code -> code == 409).hasSize(conflicted);
    }

    @And("이벤트 로그의 이벤트 수는 변하지 않는다")
    public void 이벤트_로그의_이벤트_수는_변하지_않는다() {
        assertThat(countEvents()).isEqualTo(context.getEventCountBefore());
    }

    @And("재구성된 예약은 재구성 전과 같다")
    public void 재구성된_예약은_재구성_전과_같다() {
        String after = bookingAdapter.getBooking(context.getCurrentBookingId()).jsonPath().getString("data");
        assertThat(after).isEqualTo(context.getBookingBeforeRebuild());
        assertThat(context.getLastHttpResponse().jsonPath().getString("data")).isEqualTo(after);
    }

    private int countEvents() {
        int total = 0;
        long offset = 0;
        while (true) {
            Response response = bookingAdapter.exportEvents(offset, EXPORT_PAGE_SIZE);
            List<Object> events = response.jsonPath().getList("data.events");
            total += events.size();
            Long next = response.jsonPath().getObject("data.nextOffset", Long.class);
            if (events.size() < EXPORT_PAGE_SIZE || next == null) {
                return total;
            }
            offset = next;
        }
    }
}
