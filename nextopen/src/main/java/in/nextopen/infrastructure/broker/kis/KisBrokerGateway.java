package in.nextopen.infrastructure.broker.kis;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.nextopen.config.NextOpenConfig;
import in.nextopen.config.NextOpenConfig.KisConfig;
import in.nextopen.domain.broker.BrokerOrderRef;
import in.nextopen.domain.broker.CancelAck;
import in.nextopen.domain.broker.FillRecord;
import in.nextopen.domain.broker.HoldingRecord;
import in.nextopen.domain.data.DailyBar;
import in.nextopen.domain.order.OrderSide;
import in.nextopen.domain.order.OrderType;
import in.nextopen.infrastructure.broker.BrokerGateway;
import in.nextopen.infrastructure.broker.BrokerRejectionException;
import in.nextopen.infrastructure.broker.BrokerTransientException;
import in.nextopen.infrastructure.broker.ListingDateSource;
import in.nextopen.infrastructure.broker.common.BrokerCall;
import in.nextopen.infrastructure.broker.common.BrokerHttpResponse;
import in.nextopen.infrastructure.broker.common.BrokerTransport;
import in.nextopen.infrastructure.broker.common.JdkHttpTransport;
import in.nextopen.infrastructure.broker.common.RateLimitedBrokerClient;
import in.nextopen.infrastructure.broker.common.Sleeper;
import in.nextopen.infrastructure.broker.common.TokenCache;
import in.nextopen.infrastructure.broker.metrics.GatewayMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * BrokerGateway over the Korea Investment &amp; Securities Open API (domestic cash equities).
 *
 * Every call goes through {@link RateLimitedBrokerClient}. Transaction ids differ between the
 * paper and production environments.
 */
public class KisBrokerGateway implements BrokerGateway, ListingDateSource {

    private static final Logger log = LoggerFactory.getLogger(KisBrokerGateway.class);

    public static final String BROKER_CODE = "KIS";

    static final String ORDER_PATH = "/uapi/domestic-stock/v1/trading/order-cash";
    static final String CANCEL_PATH = "/uapi/domestic-stock/v1/trading/order-rvsecncl";
    static final String FILLS_PATH = "/uapi/domestic-stock/v1/trading/inquire-daily-ccld";
    static final String BALANCE_PATH = "/uapi/domestic-stock/v1/trading/inquire-balance";
    static final String HISTORY_PATH = "/uapi/domestic-stock/v1/quotations/inquire-daily-itemchartprice";
    static final String STOCK_INFO_PATH = "/uapi/domestic-stock/v1/quotations/search-stock-info";

    static final int MAX_PAGES = 50;

    /**
     * Rows returned by one daily-chart inquiry at most. A full response may have dropped older bars.
     */
    static final int HISTORY_ROW_LIMIT = 100;

    private final KisConfig config;
    private final RateLimitedBrokerClient client;
    private final ObjectMapper mapper;

    public KisBrokerGateway(KisConfig config, RateLimitedBrokerClient client, ObjectMapper mapper) {
        this.config = config;
        this.client = client;
        this.mapper = mapper;
    }

    /**
     * Wire the gateway with the JDK HTTP transport and an on-disk token cache.
     */
    public static KisBrokerGateway create(NextOpenConfig config, ObjectMapper mapper, Sleeper sleeper,
                                          GatewayMetrics metrics, Clock clock) {
        KisConfig kis = config.kis();
        BrokerTransport transport = new JdkHttpTransport(
            config.gateway().connectTimeout(), config.gateway().readTimeout());
        TokenCache tokenCache = new TokenCache(BROKER_CODE, tokenScope(kis),
            new KisTokenIssuer(kis, transport, mapper, clock),
            config.gateway().tokenRefreshWindow(), kis.tokenCachePath(), mapper, clock, metrics);

        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("content-type", "application/json; charset=utf-8");
        headers.put("appkey", kis.appKey());
        headers.put("appsecret", kis.appSecret());
        headers.put("custtype", kis.custType());

        RateLimitedBrokerClient client = RateLimitedBrokerClient.create(BROKER_CODE, kis.baseUrl(), headers,
            transport, tokenCache, new KisResponseClassifier(mapper), sleeper, metrics, config.gateway());
        return new KisBrokerGateway(kis, client, mapper);
    }

    static String tokenScope(KisConfig kis) {
        String key = kis.appKey() == null ? "" : kis.appKey();
        return kis.env() + ":" + (key.length() > 8 ? key.substring(0, 8) : key);
    }

    @Override
    public BrokerOrderRef createOrder(String code, OrderSide side, int qty, BigDecimal price, OrderType orderType) {
        String trId = side == OrderSide.BUY ? trId("VTTC0802U", "TTTC0802U") : trId("VTTC0801U", "TTTC0801U");
        ObjectNode body = accountBody();
        body.put("PDNO", code);
        body.put("ORD_DVSN", orderType == OrderType.LIMIT ? "00" : "01");
        body.put("ORD_QTY", String.valueOf(qty));
        body.put("ORD_UNPR", orderType == OrderType.LIMIT && price != null
            ? price.setScale(0, RoundingMode.DOWN).toPlainString()
            : "0");

        log.info("[KIS] Placing order: {} {} qty={} type={} price={}", side, code, qty, orderType, price);
        JsonNode response = post("createOrder", ORDER_PATH, trId, body);
        JsonNode output = response.path("output");
        String orderId = KisPayloads.text(output, "ODNO");
        String orgId = KisPayloads.text(output, "KRX_FWDG_ORD_ORGNO");
        if (orderId.isEmpty()) {
            throw new BrokerRejectionException(BROKER_CODE, "createOrder", 200, "NO_ODNO",
                "Order accepted without an order number: " + KisPayloads.text(response, "msg1"));
        }
        log.info("[KIS] Order placed: {} {} odno={} orgno={}", side, code, orderId, orgId);
        return new BrokerOrderRef(orderId, orgId);
    }

    @Override
    public CancelAck cancelOrder(BrokerOrderRef ref) {
        ObjectNode body = accountBody();
        body.put("KRX_FWDG_ORD_ORGNO", ref.orgId() == null ? "" : ref.orgId());
        body.put("ORGN_ODNO", ref.orderId());
        body.put("ORD_DVSN", "00");
        body.put("RVSE_CNCL_DVSN_CD", "02");
        body.put("ORD_QTY", "0");
        body.put("ORD_UNPR", "0");
        body.put("QTY_ALL_ORD_YN", "Y");

        log.info("[KIS] Cancelling order odno={}", ref.orderId());
        JsonNode response = post("cancelOrder", CANCEL_PATH, trId("VTTC0803U", "TTTC0803U"), body);
        return new CancelAck(ref.orderId(),
            KisPayloads.text(response.path("output"), "ODNO"),
            KisPayloads.text(response, "msg1"));
    }

    @Override
    public List<FillRecord> getFills(LocalDate date) {
        Map<String, String> query = accountQuery();
        query.put("INQR_STRT_DT", KisPayloads.basicDate(date));
        query.put("INQR_END_DT", KisPayloads.basicDate(date));
        query.put("SLL_BUY_DVSN_CD", "00");
        query.put("INQR_DVSN", "00");
        query.put("PDNO", "");
        query.put("CCLD_DVSN", "00");
        query.put("ORD_GNO_BRNO", "");
        query.put("ODNO", "");
        query.put("INQR_DVSN_3", "00");
        query.put("INQR_DVSN_1", "");

        List<FillRecord> fills = new ArrayList<>();
        for (JsonNode row : getPaged("getFills", FILLS_PATH, trId("VTTC8001R", "TTTC8001R"), query, "output1")) {
            String orderId = KisPayloads.text(row, "odno");
            if (orderId.isEmpty()) {
                continue;
            }
            fills.add(new FillRecord(
                orderId,
                KisPayloads.text(row, "ord_gno_brno"),
                KisPayloads.text(row, "pdno"),
                "01".equals(KisPayloads.text(row, "sll_buy_dvsn_cd")) ? OrderSide.SELL : OrderSide.BUY,
                KisPayloads.integer(row, "ord_qty"),
                KisPayloads.integer(row, "tot_ccld_qty"),
                KisPayloads.decimal(row, "avg_prvs"),
                "Y".equalsIgnoreCase(KisPayloads.text(row, "cncl_yn"))
            ));
        }
        log.info("[KIS] {} order records for {}", fills.size(), date);
        return fills;
    }

    @Override
    public List<HoldingRecord> getBalances() {
        Map<String, String> query = accountQuery();
        query.put("AFHR_FLPR_YN", "N");
        query.put("OFL_YN", "");
        query.put("INQR_DVSN", "02");
        query.put("UNPR_DVSN", "01");
        query.put("FUND_STTL_ICLD_YN", "N");
        query.put("FNCG_AMT_AUTO_RDPT_YN", "N");
        query.put("PRCS_DVSN", "01");

        List<HoldingRecord> holdings = new ArrayList<>();
        for (JsonNode row : getPaged("getBalances", BALANCE_PATH, trId("VTTC8434R", "TTTC8434R"), query, "output1")) {
            int qty = KisPayloads.integer(row, "hldg_qty");
            if (qty <= 0) {
                continue;
            }
            holdings.add(new HoldingRecord(
                KisPayloads.text(row, "pdno"),
                KisPayloads.text(row, "prdt_name"),
                qty,
                KisPayloads.decimal(row, "pchs_avg_pric")
            ));
        }
        return holdings;
    }

    @Override
    public List<DailyBar> getHistory(String code, LocalDate from, LocalDate to) {
        Map<String, String> query = new LinkedHashMap<>();
        query.put("FID_COND_MRKT_DIV_CODE", "J");
        query.put("FID_INPUT_ISCD", code);
        query.put("FID_INPUT_DATE_1", KisPayloads.basicDate(from));
        query.put("FID_INPUT_DATE_2", KisPayloads.basicDate(to));
        query.put("FID_PERIOD_DIV_CODE", "D");
        query.put("FID_ORG_ADJ_PRC", "0");

        BrokerHttpResponse response = client.execute(BrokerCall.get("getHistory", HISTORY_PATH,
            Map.of("tr_id", "FHKST03010100"), query));
        JsonNode rows = readBody("getHistory", response).path("output2");

        if (rows.size() >= HISTORY_ROW_LIMIT && from.isBefore(to)) {
            LocalDate mid = from.plusDays(ChronoUnit.DAYS.between(from, to) / 2);
            log.debug("[KIS] {} {}..{} hit the {} row limit, splitting at {}", code, from, to, HISTORY_ROW_LIMIT, mid);
            List<DailyBar> bars = new ArrayList<>(getHistory(code, from, mid));
            bars.addAll(getHistory(code, mid.plusDays(1), to));
            return bars;
        }

        List<DailyBar> bars = new ArrayList<>();
        for (JsonNode row : rows) {
            LocalDate tradeDate = KisPayloads.date(row, "stck_bsop_date");
            BigDecimal close = KisPayloads.decimal(row, "stck_clpr");
            if (tradeDate == null || close == null || tradeDate.isBefore(from) || tradeDate.isAfter(to)) {
                continue;
            }
            BigDecimal amount = KisPayloads.decimal(row, "acml_tr_pbmn");
            bars.add(new DailyBar(
                code,
                tradeDate,
                KisPayloads.decimal(row, "stck_oprc"),
                KisPayloads.decimal(row, "stck_hgpr"),
                KisPayloads.decimal(row, "stck_lwpr"),
                close,
                KisPayloads.longValue(row, "acml_vol"),
                amount != null ? amount : BigDecimal.ZERO
            ));
        }
        bars.sort(Comparator.comparing(DailyBar::tradeDate));
        log.debug("[KIS] {} bars for {} {}..{}", bars.size(), code, from, to);
        return bars;
    }

    /**
     * Listing date from the stock basic-info inquiry, KOSPI date first then KOSDAQ.
     */
    @Override
    public Optional<LocalDate> getListingDate(String code) {
        Map<String, String> query = new LinkedHashMap<>();
        query.put("PRDT_TYPE_CD", "300");
        query.put("PDNO", code);

        BrokerHttpResponse response = client.execute(BrokerCall.get("getListingDate", STOCK_INFO_PATH,
            Map.of("tr_id", "CTPF1002R"), query));
        JsonNode output = readBody("getListingDate", response).path("output");
        LocalDate kospi = KisPayloads.date(output, "scts_mket_lstg_dt");
        return Optional.ofNullable(kospi != null ? kospi : KisPayloads.date(output, "kosdaq_mket_lstg_dt"));
    }

    private JsonNode post(String operation, String path, String trId, ObjectNode body) {
        BrokerHttpResponse response = client.execute(BrokerCall.post(operation, path,
            Map.of("tr_id", trId), body.toString()));
        return readBody(operation, response);
    }

    /**
     * Follow KIS continuation: response header {@code tr_cont} F/M means another page,
     * requested with {@code tr_cont: N} and the returned CTX_AREA keys.
     */
    private List<JsonNode> getPaged(String operation, String path, String trId,
                                    Map<String, String> baseQuery, String listField) {
        List<JsonNode> rows = new ArrayList<>();
        String fk = "";
        String nk = "";
        String trCont = "";
        for (int page = 0; page < MAX_PAGES; page++) {
            Map<String, String> query = new LinkedHashMap<>(baseQuery);
            query.put("CTX_AREA_FK100", fk);
            query.put("CTX_AREA_NK100", nk);
            Map<String, String> headers = new LinkedHashMap<>();
            headers.put("tr_id", trId);
            if (!trCont.isEmpty()) {
                headers.put("tr_cont", trCont);
            }

            BrokerHttpResponse response = client.execute(BrokerCall.get(operation, path, headers, query));
            JsonNode root = readBody(operation, response);
            root.path(listField).forEach(rows::add);

            String more = response.header("tr_cont");
            if (!"F".equals(more) && !"M".equals(more)) {
                return rows;
            }
            fk = KisPayloads.text(root, "ctx_area_fk100");
            nk = KisPayloads.text(root, "ctx_area_nk100");
            trCont = "N";
        }
        throw new BrokerTransientException(BROKER_CODE, operation, 200,
            "Continuation still open after " + MAX_PAGES + " pages, result would be incomplete");
    }

    private JsonNode readBody(String operation, BrokerHttpResponse response) {
        try {
            return mapper.readTree(response.body());
        } catch (IOException e) {
            throw new BrokerRejectionException(BROKER_CODE, operation, response.status(), "UNPARSEABLE",
                "Response body is not JSON");
        }
    }

    private ObjectNode accountBody() {
        ObjectNode body = mapper.createObjectNode();
        body.put("CANO", config.accountNo());
        body.put("ACNT_PRDT_CD", config.accountProduct());
        return body;
    }

    private Map<String, String> accountQuery() {
        Map<String, String> query = new LinkedHashMap<>();
        query.put("CANO", config.accountNo());
        query.put("ACNT_PRDT_CD", config.accountProduct());
        return query;
    }

    private String trId(String paperCode, String prodCode) {
        return config.isPaper() ? paperCode : prodCode;
    }
}
