package world.willfrog.storeagent.agent;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import world.willfrog.storeagent.action.ActionTargets;
import world.willfrog.storeagent.action.ActionTypes;
import world.willfrog.storeagent.action.ProposedAction;
import world.willfrog.storeagent.common.util.PayloadValues;
import world.willfrog.storeagent.entity.AgentRun;
import world.willfrog.storeagent.entity.Product;
import world.willfrog.storeagent.entity.StoreAgent;
import world.willfrog.storeagent.mapper.ProductMapper;
import world.willfrog.storeagent.model.AgentType;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Finds inventory that has not sold for a long time and proposes tiered markdowns, highest stock value first.
 */
@Slf4j
@Component
public class DeadStockAgent extends AbstractAgent {

    static final String SLUG = "dead-stock";

    private final ProductMapper productMapper;

    public DeadStockAgent(AgentSupport support, ProductMapper productMapper) {
        super(support);
        this.productMapper = productMapper;
    }

    @Override
    public String getSlug() {
        return SLUG;
    }

    @Override
    public String getName() {
        return "Dead Stock";
    }

    @Override
    public String getDescription() {
        return "Identifies slow-moving inventory and proposes markdowns";
    }

    @Override
    public AgentType getType() {
        return AgentType.BACKGROUND;
    }

    @Override
    public Map<String, Object> getDefaultConfig() {
        Map<String, Object> schedule = new LinkedHashMap<>();
        schedule.put("90", 10);
        schedule.put("120", 20);
        schedule.put("150", 30);
        schedule.put("180", 40);

        Map<String, Object> defaults = new LinkedHashMap<>();
        defaults.put("slow_mover_days", 90);
        defaults.put("dead_stock_days", 180);
        defaults.put("markdown_schedule", schedule);
        defaults.put("exclude_categories", List.of());
        defaults.put("min_value_threshold", 25);
        defaults.put("max_items_per_run", 100);
        defaults.put(RUN_FREQUENCY, "weekly");
        return defaults;
    }

    @Override
    public Map<String, ConfigField> getConfigSchema() {
        Map<String, ConfigField> schema = new LinkedHashMap<>();
        schema.put("slow_mover_days", ConfigField.number("Slow Mover (days)", "Days without a sale before an item is slow", 7, 730));
        schema.put("dead_stock_days", ConfigField.number("Dead Stock (days)", "Days without a sale before an item is dead stock", 7, 1095));
        schema.put("markdown_schedule", ConfigField.object("Markdown Schedule", "Days idle -> discount percent"));
        schema.put("exclude_categories", ConfigField.array("Excluded Categories", "Category names never marked down"));
        schema.put("min_value_threshold", ConfigField.number("Minimum Value ($)", "Ignore stock worth less than this"));
        schema.put("max_items_per_run", ConfigField.number("Max Items Per Run", "Products analyzed per run", 1, 1000));
        schema.put(RUN_FREQUENCY, ConfigField.select("Run Frequency", "How often the agent runs", Cadences.OPTIONS));
        return schema;
    }

    @Override
    public AgentRunResult run(AgentRun run, StoreAgent storeAgent) {
        AgentConfig config = config(storeAgent);
        OffsetDateTime now = OffsetDateTime.now();
        int deadStockDays = config.getInt("dead_stock_days");
        List<Tier> tiers = tiers(config.getMap("markdown_schedule"));
        List<Product> products = productMapper.listIdleInventory(storeAgent.getStoreId(),
                now.minusDays(config.getInt("slow_mover_days")),
                config.getStringList("exclude_categories"),
                config.getDecimal("min_value_threshold"),
                config.getInt("max_items_per_run"));

        int slowMovers = 0;
        int deadStock = 0;
        int proposed = 0;
        List<Map<String, Object>> errors = new ArrayList<>();
        for (Product product : products) {
            try {
                OffsetDateTime lastActivity = product.getLastSoldAt() != null ? product.getLastSoldAt() : product.getCreatedAt();
                long daysIdle = lastActivity == null ? 0 : ChronoUnit.DAYS.between(lastActivity, now);
                boolean dead = daysIdle >= deadStockDays;
                if (dead) {
                    deadStock++;
                } else {
                    slowMovers++;
                }
                int discount = discountFor(daysIdle, tiers);
                if (discount <= 0 || product.getPrice() == null) {
                    continue;
                }
                if (propose(run, storeAgent, markdown(product, daysIdle, discount, dead))) {
                    proposed++;
                }
            } catch (RuntimeException e) {
                log.warn("Markdown evaluation failed storeId={} productId={}: {}",
                        storeAgent.getStoreId(), product.getId(), e.getMessage());
                errors.add(entityError("product_id", product.getId(), e));
            }
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("products_analyzed", products.size());
        data.put("slow_movers_found", slowMovers);
        data.put("dead_stock_found", deadStock);
        data.put("markdowns_proposed", proposed);
        if (!errors.isEmpty()) {
            data.put("errors", errors);
        }
        return AgentRunResult.success(data, proposed);
    }

    private ProposedAction markdown(Product product, long daysIdle, int discount, boolean dead) {
        BigDecimal newPrice = product.getPrice()
                .multiply(BigDecimal.valueOf(100 - discount))
                .divide(BigDecimal.valueOf(100), 2, RoundingMode.HALF_UP);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("before", Map.of("price", product.getPrice()));
        payload.put("after", Map.of("price", newPrice));
        payload.put("discount_percent", discount);
        payload.put("days_idle", daysIdle);
        payload.put("tier", dead ? "dead_stock" : "slow_mover");
        payload.put("reasoning", String.format("Product '%s' (SKU: %s) has gone %d days without a sale. "
                + "The markdown schedule recommends a %d%% discount to improve turnover.",
                product.getTitle(), product.getSku(), daysIdle, discount));
        return ProposedAction.builder()
                .actionType(ActionTypes.MARKDOWN_SCHEDULE)
                .targetType(ActionTargets.PRODUCT)
                .targetId(String.valueOf(product.getId()))
                .payload(payload)
                .build();
    }

    static int discountFor(long daysIdle, List<Tier> tiers) {
        for (Tier tier : tiers) {
            if (daysIdle >= tier.days()) {
                return tier.discountPercent();
            }
        }
        return 0;
    }

    /**
     * Schedule entries sorted by days, longest first. Entries with a non-numeric key or value are dropped.
     */
    static List<Tier> tiers(Map<String, Object> schedule) {
        List<Tier> tiers = new ArrayList<>();
        schedule.forEach((days, discount) -> {
            BigDecimal dayValue = PayloadValues.toDecimal(days);
            BigDecimal discountValue = PayloadValues.toDecimal(discount);
            if (dayValue != null && discountValue != null) {
                tiers.add(new Tier(dayValue.intValue(), discountValue.intValue()));
            }
        });
        tiers.sort(Comparator.comparingInt(Tier::days).reversed());
        return tiers;
    }

    record Tier(int days, int discountPercent) {
    }
}
