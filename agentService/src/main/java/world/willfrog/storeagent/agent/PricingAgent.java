package world.willfrog.storeagent.agent;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import world.willfrog.storeagent.action.ActionTargets;
import world.willfrog.storeagent.action.ActionTypes;
import world.willfrog.storeagent.action.ProposedAction;
import world.willfrog.storeagent.entity.AgentRun;
import world.willfrog.storeagent.entity.Product;
import world.willfrog.storeagent.entity.StoreAgent;
import world.willfrog.storeagent.exception.ExternalServiceException;
import world.willfrog.storeagent.integration.MarketSummary;
import world.willfrog.storeagent.integration.PriceIntelligenceService;
import world.willfrog.storeagent.integration.PriceSearchCriteria;
import world.willfrog.storeagent.mapper.ProductMapper;
import world.willfrog.storeagent.model.AgentType;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Compares stale product prices with the market median and proposes bounded adjustments.
 * <p>
 * Candidates are processed oldest check first. A product whose market lookup fails is counted as skipped
 * and the run carries on.
 */
@Slf4j
@Component
public class PricingAgent extends AbstractAgent {

    static final String SLUG = "auto-pricing";

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final BigDecimal MIN_CHANGE = new BigDecimal("0.01");

    private final ProductMapper productMapper;
    private final PriceIntelligenceService priceIntelligence;

    public PricingAgent(AgentSupport support, ProductMapper productMapper, PriceIntelligenceService priceIntelligence) {
        super(support);
        this.productMapper = productMapper;
        this.priceIntelligence = priceIntelligence;
    }

    @Override
    public String getSlug() {
        return SLUG;
    }

    @Override
    public String getName() {
        return "Auto Pricing";
    }

    @Override
    public String getDescription() {
        return "Checks product prices against market data and proposes adjustments";
    }

    @Override
    public AgentType getType() {
        return AgentType.BACKGROUND;
    }

    @Override
    public Map<String, Object> getDefaultConfig() {
        Map<String, Object> defaults = new LinkedHashMap<>();
        defaults.put("price_check_threshold_days", 30);
        defaults.put("max_items_per_run", 50);
        defaults.put("auto_adjust_threshold", 10);
        defaults.put("require_approval_above", 100);
        defaults.put("pricing_strategy", "competitive");
        defaults.put("max_price_decrease_percent", 25);
        defaults.put("max_price_increase_percent", 15);
        defaults.put(RUN_FREQUENCY, "daily");
        return defaults;
    }

    @Override
    public Map<String, ConfigField> getConfigSchema() {
        Map<String, ConfigField> schema = new LinkedHashMap<>();
        schema.put("price_check_threshold_days", ConfigField.number("Check Interval (days)",
                "Re-check a product's price after this many days", 1, 365));
        schema.put("max_items_per_run", ConfigField.number("Max Items Per Run", "Products checked per run", 1, 500));
        schema.put("auto_adjust_threshold", ConfigField.number("Adjustment Threshold (%)",
                "Only propose a change when the price deviates from the market by more than this", 0, 100));
        schema.put("require_approval_above", ConfigField.number("Approval Above ($)",
                "New prices above this amount need approval"));
        schema.put("pricing_strategy", ConfigField.select("Pricing Strategy", "How to position against the market",
                Map.of("competitive", "Match market median", "undercut", "5% below median", "premium", "10% above median")));
        schema.put("max_price_decrease_percent", ConfigField.number("Max Decrease (%)",
                "Largest decrease in one adjustment", 0, 100));
        schema.put("max_price_increase_percent", ConfigField.number("Max Increase (%)",
                "Largest increase in one adjustment", 0, 1000));
        schema.put(RUN_FREQUENCY, ConfigField.select("Run Frequency", "How often the agent runs", Cadences.OPTIONS));
        return schema;
    }

    @Override
    public AgentRunResult run(AgentRun run, StoreAgent storeAgent) {
        AgentConfig config = config(storeAgent);
        OffsetDateTime now = OffsetDateTime.now();
        List<Product> candidates = productMapper.listPriceCheckCandidates(storeAgent.getStoreId(),
                now.minusDays(config.getInt("price_check_threshold_days")), config.getInt("max_items_per_run"));

        int analyzed = 0;
        int skipped = 0;
        int proposed = 0;
        List<Map<String, Object>> errors = new ArrayList<>();
        for (Product product : candidates) {
            analyzed++;
            try {
                productMapper.touchPriceCheck(product.getId(), now);
                MarketSummary market = priceIntelligence.marketSummary(storeAgent.getStoreId(), criteriaFor(product));
                ProposedAction proposal = evaluate(product, market, config);
                if (proposal == null) {
                    skipped++;
                } else if (propose(run, storeAgent, proposal)) {
                    proposed++;
                }
            } catch (ExternalServiceException e) {
                log.warn("Market data unavailable storeId={} productId={}: {}",
                        storeAgent.getStoreId(), product.getId(), e.getMessage());
                skipped++;
                errors.add(entityError("product_id", product.getId(), e));
            } catch (RuntimeException e) {
                log.error("Price check failed storeId={} productId={}", storeAgent.getStoreId(), product.getId(), e);
                skipped++;
                errors.add(entityError("product_id", product.getId(), e));
            }
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("products_analyzed", analyzed);
        data.put("products_skipped", skipped);
        data.put("price_updates_proposed", proposed);
        if (!errors.isEmpty()) {
            data.put("errors", errors);
        }
        return AgentRunResult.success(data, proposed);
    }

    /**
     * @return the proposal, or null when the price is close enough to the market
     */
    ProposedAction evaluate(Product product, MarketSummary market, AgentConfig config) {
        BigDecimal current = product.getPrice();
        BigDecimal median = market.getMedian();
        BigDecimal deviation = current.subtract(median).abs()
                .multiply(HUNDRED)
                .divide(median, 4, RoundingMode.HALF_UP);
        if (deviation.compareTo(config.getDecimal("auto_adjust_threshold")) < 0) {
            return null;
        }

        String strategy = config.getString("pricing_strategy");
        BigDecimal suggested = switch (strategy) {
            case "undercut" -> median.multiply(new BigDecimal("0.95"));
            case "premium" -> median.multiply(new BigDecimal("1.10"));
            default -> median;
        };
        BigDecimal lower = current.multiply(BigDecimal.ONE.subtract(percent(config.getDecimal("max_price_decrease_percent"))));
        BigDecimal upper = current.multiply(BigDecimal.ONE.add(percent(config.getDecimal("max_price_increase_percent"))));
        suggested = suggested.max(lower).min(upper).setScale(2, RoundingMode.HALF_UP);
        if (suggested.subtract(current).abs().compareTo(MIN_CHANGE) < 0) {
            return null;
        }

        BigDecimal changePercent = suggested.subtract(current)
                .multiply(HUNDRED)
                .divide(current, 2, RoundingMode.HALF_UP);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("before", Map.of("price", current));
        payload.put("after", Map.of("price", suggested));
        Map<String, Object> marketData = new LinkedHashMap<>();
        marketData.put("median", median);
        marketData.put("min", market.getMin());
        marketData.put("max", market.getMax());
        marketData.put("sample_size", market.getCount());
        payload.put("market_data", marketData);
        payload.put("price_difference_percent", changePercent);
        payload.put("strategy", strategy);
        payload.put("reasoning", reasoning(current, suggested, median, market.getCount(), deviation, strategy));
        payload.put("approval_threshold", config.getDecimal("require_approval_above"));

        return ProposedAction.builder()
                .actionType(ActionTypes.PRICE_UPDATE)
                .targetType(ActionTargets.PRODUCT)
                .targetId(String.valueOf(product.getId()))
                .payload(payload)
                .build();
    }

    private static BigDecimal percent(BigDecimal value) {
        return value.divide(HUNDRED, 4, RoundingMode.HALF_UP);
    }

    private static PriceSearchCriteria criteriaFor(Product product) {
        return PriceSearchCriteria.builder()
                .title(product.getTitle())
                .category(product.getCategoryName())
                .brand(product.getBrand())
                .condition(product.getCondition())
                .attributes(Map.of())
                .build();
    }

    private static String reasoning(BigDecimal current, BigDecimal suggested, BigDecimal median, Integer sampleSize,
                                    BigDecimal deviation, String strategy) {
        String direction = current.compareTo(median) < 0 ? "below" : "above";
        return String.format("Market median is $%s across %s listings; current price $%s is %s%% %s market. "
                        + "Strategy %s suggests $%s.",
                median.setScale(2, RoundingMode.HALF_UP), sampleSize == null ? "?" : sampleSize,
                current.setScale(2, RoundingMode.HALF_UP), deviation.setScale(1, RoundingMode.HALF_UP),
                direction, strategy, suggested);
    }
}
