package world.willfrog.storeagent.agent;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import world.willfrog.storeagent.action.ActionTargets;
import world.willfrog.storeagent.action.ActionTypes;
import world.willfrog.storeagent.action.ProposedAction;
import world.willfrog.storeagent.common.util.PayloadValues;
import world.willfrog.storeagent.entity.AgentRun;
import world.willfrog.storeagent.entity.ChannelSales;
import world.willfrog.storeagent.entity.ProductSales;
import world.willfrog.storeagent.entity.SalesTotals;
import world.willfrog.storeagent.entity.StoreAgent;
import world.willfrog.storeagent.integration.GenerativeTextClient;
import world.willfrog.storeagent.mapper.SalesReportMapper;
import world.willfrog.storeagent.mapper.StoreMarketplaceMapper;
import world.willfrog.storeagent.model.AgentType;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only sales analysis over a bounded window. The only proposals are decline alerts; the generative
 * summary is optional and an unavailable model yields no insights rather than a failed run.
 */
@Slf4j
@Component
public class SalesIntelligenceAgent extends AbstractAgent {

    static final String SLUG = "sales-intelligence";

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final int SLOW_MOVER_MIN_QUANTITY = 10;
    private static final int MAX_DECLINE_ALERTS = 10;

    private final SalesReportMapper salesReportMapper;
    private final StoreMarketplaceMapper marketplaceMapper;
    private final GenerativeTextClient generativeTextClient;

    public SalesIntelligenceAgent(AgentSupport support,
                                  SalesReportMapper salesReportMapper,
                                  StoreMarketplaceMapper marketplaceMapper,
                                  GenerativeTextClient generativeTextClient) {
        super(support);
        this.salesReportMapper = salesReportMapper;
        this.marketplaceMapper = marketplaceMapper;
        this.generativeTextClient = generativeTextClient;
    }

    @Override
    public String getSlug() {
        return SLUG;
    }

    @Override
    public String getName() {
        return "Sales Intelligence";
    }

    @Override
    public String getDescription() {
        return "Analyzes sales performance, flags declining products and surfaces opportunities";
    }

    @Override
    public AgentType getType() {
        return AgentType.PROACTIVE;
    }

    @Override
    public Map<String, Object> getDefaultConfig() {
        Map<String, Object> defaults = new LinkedHashMap<>();
        defaults.put("analysis_period_days", 30);
        defaults.put("comparison_period_days", 30);
        defaults.put("top_performers_count", 10);
        defaults.put("declining_threshold_percent", 20);
        defaults.put("enable_ai_insights", true);
        defaults.put(RUN_FREQUENCY, "daily");
        return defaults;
    }

    @Override
    public Map<String, ConfigField> getConfigSchema() {
        Map<String, ConfigField> schema = new LinkedHashMap<>();
        schema.put("analysis_period_days", ConfigField.number("Analysis Period (days)", "Window analyzed", 1, 365));
        schema.put("comparison_period_days", ConfigField.number("Comparison Period (days)", "Previous window compared against", 1, 365));
        schema.put("top_performers_count", ConfigField.number("Top Performers", "Products listed as top performers", 1, 100));
        schema.put("declining_threshold_percent", ConfigField.number("Decline Alert (%)", "Revenue drop that raises an alert", 1, 100));
        schema.put("enable_ai_insights", ConfigField.bool("AI Insights", "Ask the language model for a summary"));
        schema.put(RUN_FREQUENCY, ConfigField.select("Run Frequency", "How often the agent runs", Cadences.OPTIONS));
        return schema;
    }

    @Override
    public AgentRunResult run(AgentRun run, StoreAgent storeAgent) {
        AgentConfig config = config(storeAgent);
        Long storeId = storeAgent.getStoreId();
        OffsetDateTime now = OffsetDateTime.now();
        int analysisDays = config.getInt("analysis_period_days");
        OffsetDateTime from = now.minusDays(analysisDays);
        OffsetDateTime previousFrom = from.minusDays(config.getInt("comparison_period_days"));

        SalesTotals current = salesReportMapper.totals(storeId, from, now);
        SalesTotals previous = salesReportMapper.totals(storeId, previousFrom, from);
        List<ChannelSales> channels = salesReportMapper.channelSales(storeId, from, now);
        List<ProductSales> products = salesReportMapper.productSales(storeId, previousFrom, from, now);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("period", analysisDays + " days");
        data.put("summary", summary(current, previous));
        data.put("channel_performance", channelPerformance(channels));
        data.put("top_performers", topPerformers(products, config.getInt("top_performers_count")));

        BigDecimal threshold = config.getDecimal("declining_threshold_percent");
        List<Map<String, Object>> declining = declining(products, threshold);
        data.put("declining_products", declining);
        int proposed = 0;
        for (Map<String, Object> product : declining) {
            if (propose(run, storeAgent, declineAlert(product))) {
                proposed++;
            }
        }
        data.put("opportunities", opportunities(products, marketplaceMapper.countActiveByStore(storeId)));
        data.put("insights", config.getBoolean("enable_ai_insights") ? insights(data) : List.of());
        return AgentRunResult.success(data, proposed);
    }

    private Map<String, Object> summary(SalesTotals current, SalesTotals previous) {
        BigDecimal revenue = revenueOf(current);
        int orders = ordersOf(current);
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("total_revenue", revenue);
        summary.put("order_count", orders);
        summary.put("units_sold", current == null || current.getUnitsSold() == null ? 0 : current.getUnitsSold());
        summary.put("average_order_value", orders == 0 ? BigDecimal.ZERO
                : revenue.divide(BigDecimal.valueOf(orders), 2, RoundingMode.HALF_UP));
        summary.put("revenue_growth", growth(revenue, revenueOf(previous)));
        summary.put("order_growth", growth(BigDecimal.valueOf(orders), BigDecimal.valueOf(ordersOf(previous))));
        return summary;
    }

    private static Map<String, Object> channelPerformance(List<ChannelSales> channels) {
        BigDecimal total = channels.stream()
                .map(channel -> channel.getRevenue() == null ? BigDecimal.ZERO : channel.getRevenue())
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        Map<String, Object> performance = new LinkedHashMap<>();
        for (ChannelSales channel : channels) {
            BigDecimal revenue = channel.getRevenue() == null ? BigDecimal.ZERO : channel.getRevenue();
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("orders", channel.getOrderCount() == null ? 0 : channel.getOrderCount());
            entry.put("revenue", revenue);
            entry.put("revenue_percent", total.signum() == 0 ? BigDecimal.ZERO
                    : revenue.multiply(HUNDRED).divide(total, 1, RoundingMode.HALF_UP));
            performance.put(channel.getChannel(), entry);
        }
        return performance;
    }

    private static List<Map<String, Object>> topPerformers(List<ProductSales> products, int limit) {
        return products.stream()
                .filter(product -> product.getRevenue() != null && product.getRevenue().signum() > 0)
                .sorted(Comparator.comparing(ProductSales::getRevenue).reversed())
                .limit(limit)
                .map(product -> {
                    Map<String, Object> entry = new LinkedHashMap<>();
                    entry.put("product_id", product.getProductId());
                    entry.put("title", product.getTitle());
                    entry.put("sku", product.getSku());
                    entry.put("units_sold", product.getUnitsSold());
                    entry.put("revenue", product.getRevenue());
                    return entry;
                })
                .toList();
    }

    static List<Map<String, Object>> declining(List<ProductSales> products, BigDecimal threshold) {
        List<Map<String, Object>> declining = new ArrayList<>();
        for (ProductSales product : products) {
            BigDecimal previous = product.getPreviousRevenue();
            if (previous == null || previous.signum() <= 0) {
                continue;
            }
            BigDecimal current = product.getRevenue() == null ? BigDecimal.ZERO : product.getRevenue();
            BigDecimal decline = previous.subtract(current).multiply(HUNDRED).divide(previous, 1, RoundingMode.HALF_UP);
            if (decline.compareTo(threshold) < 0) {
                continue;
            }
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("product_id", product.getProductId());
            entry.put("title", product.getTitle());
            entry.put("sku", product.getSku());
            entry.put("previous_revenue", previous);
            entry.put("current_revenue", current);
            entry.put("decline_percent", decline);
            declining.add(entry);
        }
        declining.sort(Comparator.comparing((Map<String, Object> entry) -> (BigDecimal) entry.get("decline_percent")).reversed());
        return declining.size() > MAX_DECLINE_ALERTS ? declining.subList(0, MAX_DECLINE_ALERTS) : declining;
    }

    private static List<Map<String, Object>> opportunities(List<ProductSales> products, int activeMarketplaces) {
        List<Map<String, Object>> opportunities = new ArrayList<>();
        for (ProductSales product : products) {
            BigDecimal revenue = product.getRevenue() == null ? BigDecimal.ZERO : product.getRevenue();
            int listed = product.getListedChannels() == null ? 0 : product.getListedChannels();
            int onHand = product.getQuantityOnHand() == null ? 0 : product.getQuantityOnHand();
            if (revenue.signum() > 0 && activeMarketplaces > 0 && listed < activeMarketplaces) {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("type", "expand_distribution");
                entry.put("product_id", product.getProductId());
                entry.put("title", product.getTitle());
                entry.put("current_channels", listed);
                entry.put("available_channels", activeMarketplaces);
                entry.put("priority", "high");
                opportunities.add(entry);
            } else if (revenue.signum() == 0 && onHand > SLOW_MOVER_MIN_QUANTITY) {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("type", "slow_moving_inventory");
                entry.put("product_id", product.getProductId());
                entry.put("title", product.getTitle());
                entry.put("quantity", onHand);
                entry.put("priority", "medium");
                opportunities.add(entry);
            }
        }
        return opportunities;
    }

    /**
     * Best effort: any failure of the model, including a malformed answer, yields an empty list.
     */
    List<Object> insights(Map<String, Object> analysis) {
        Map<String, Object> schema = Map.of(
                "type", "object",
                "properties", Map.of("insights", Map.of(
                        "type", "array",
                        "items", Map.of("type", "object", "properties", Map.of(
                                "title", Map.of("type", "string"),
                                "description", Map.of("type", "string"),
                                "importance", Map.of("type", "string"))))));
        String prompt = "Analyze this e-commerce sales data and provide 3-5 key insights as JSON "
                + "{\"insights\":[{\"title\":\"...\",\"description\":\"...\",\"importance\":\"high|medium|low\"}]}.\n"
                + support.getJson().toJson(analysis);
        try {
            return PayloadValues.list(generativeTextClient.generateJson(prompt, schema), "insights");
        } catch (RuntimeException e) {
            log.warn("Sales insights unavailable: {}", e.getMessage());
            return List.of();
        }
    }

    private static ProposedAction declineAlert(Map<String, Object> product) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", "declining_sales");
        payload.put("product_id", product.get("product_id"));
        payload.put("product_title", product.get("title"));
        payload.put("decline_percent", product.get("decline_percent"));
        payload.put("message", String.format("'%s' sales declined by %s%% compared to the previous period",
                product.get("title"), product.get("decline_percent")));
        return ProposedAction.builder()
                .actionType(ActionTypes.SEND_NOTIFICATION)
                .targetType(ActionTargets.PRODUCT)
                .targetId(String.valueOf(product.get("product_id")))
                .payload(payload)
                .build();
    }

    private static BigDecimal growth(BigDecimal current, BigDecimal previous) {
        if (previous.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        return current.subtract(previous).multiply(HUNDRED).divide(previous, 1, RoundingMode.HALF_UP);
    }

    private static BigDecimal revenueOf(SalesTotals totals) {
        return totals == null || totals.getRevenue() == null ? BigDecimal.ZERO : totals.getRevenue();
    }

    private static int ordersOf(SalesTotals totals) {
        return totals == null || totals.getOrderCount() == null ? 0 : totals.getOrderCount();
    }
}
