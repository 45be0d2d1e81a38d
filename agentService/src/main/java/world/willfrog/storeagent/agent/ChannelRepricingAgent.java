package world.willfrog.storeagent.agent;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import world.willfrog.storeagent.action.ActionTargets;
import world.willfrog.storeagent.action.ActionTypes;
import world.willfrog.storeagent.action.ProposedAction;
import world.willfrog.storeagent.common.util.PayloadValues;
import world.willfrog.storeagent.entity.AgentRun;
import world.willfrog.storeagent.entity.PlatformListing;
import world.willfrog.storeagent.entity.StoreAgent;
import world.willfrog.storeagent.entity.StoreMarketplace;
import world.willfrog.storeagent.integration.CompetitivePricing;
import world.willfrog.storeagent.integration.PlatformConnector;
import world.willfrog.storeagent.integration.PlatformConnectorManager;
import world.willfrog.storeagent.mapper.PlatformListingMapper;
import world.willfrog.storeagent.mapper.StoreMarketplaceMapper;
import world.willfrog.storeagent.model.AgentType;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Per-marketplace listing prices: buy-box banding on amazon, parity with the base price on walmart and
 * sync-to-base elsewhere, never below the margin floor and never cut by more than the reduction cap at once.
 */
@Slf4j
@Component
public class ChannelRepricingAgent extends AbstractAgent {

    static final String SLUG = "channel-repricing";

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final BigDecimal MIN_CHANGE = new BigDecimal("0.01");

    private final StoreMarketplaceMapper marketplaceMapper;
    private final PlatformListingMapper listingMapper;
    private final PlatformConnectorManager connectorManager;

    public ChannelRepricingAgent(AgentSupport support,
                                 StoreMarketplaceMapper marketplaceMapper,
                                 PlatformListingMapper listingMapper,
                                 PlatformConnectorManager connectorManager) {
        super(support);
        this.marketplaceMapper = marketplaceMapper;
        this.listingMapper = listingMapper;
        this.connectorManager = connectorManager;
    }

    @Override
    public String getSlug() {
        return SLUG;
    }

    @Override
    public String getName() {
        return "Channel Repricing";
    }

    @Override
    public String getDescription() {
        return "Optimizes listing prices per marketplace while protecting margins";
    }

    @Override
    public AgentType getType() {
        return AgentType.BACKGROUND;
    }

    @Override
    public Map<String, Object> getDefaultConfig() {
        Map<String, Object> defaults = new LinkedHashMap<>();
        defaults.put("enabled_platforms", List.of("amazon", "walmart", "shopify"));
        defaults.put("repricing_strategy", "smart");
        defaults.put("min_margin_percent", 15);
        defaults.put("target_margin_percent", 25);
        defaults.put("max_price_reduction_percent", 20);
        defaults.put("amazon_buy_box_strategy", true);
        defaults.put("walmart_price_parity", true);
        defaults.put("update_frequency_hours", 6);
        defaults.put("max_items_per_run", 100);
        defaults.put("require_approval_for_major_changes", true);
        defaults.put("major_change_threshold_percent", 15);
        return defaults;
    }

    @Override
    public Map<String, ConfigField> getConfigSchema() {
        Map<String, ConfigField> schema = new LinkedHashMap<>();
        schema.put("enabled_platforms", ConfigField.multiselect("Platforms", "Marketplaces to reprice",
                Map.of("amazon", "Amazon", "walmart", "Walmart", "shopify", "Shopify", "ebay", "eBay", "etsy", "Etsy")));
        schema.put("repricing_strategy", ConfigField.select("Strategy", "How aggressively to chase the buy box",
                Map.of("smart", "Smart", "aggressive", "Aggressive", "conservative", "Conservative")));
        schema.put("min_margin_percent", ConfigField.number("Minimum Margin (%)", "Never price below cost plus this margin", 0, 100));
        schema.put("target_margin_percent", ConfigField.number("Target Margin (%)", "Margin to aim for", 0, 200));
        schema.put("max_price_reduction_percent", ConfigField.number("Max Reduction (%)",
                "Largest cut in a single change", 0, 100));
        schema.put("amazon_buy_box_strategy", ConfigField.bool("Amazon Buy Box", "Compete for the Amazon buy box"));
        schema.put("walmart_price_parity", ConfigField.bool("Walmart Price Parity", "Keep Walmart prices near the base price"));
        schema.put("update_frequency_hours", ConfigField.number("Update Frequency (hours)", "Hours between runs", 1, 168));
        schema.put("max_items_per_run", ConfigField.number("Max Items Per Run", "Listings analyzed per marketplace", 1, 1000));
        schema.put("require_approval_for_major_changes", ConfigField.bool("Approve Major Changes",
                "Ask for approval when a change crosses the threshold"));
        schema.put("major_change_threshold_percent", ConfigField.number("Major Change (%)",
                "Change size that counts as major", 1, 100));
        return schema;
    }

    @Override
    public boolean canRun(StoreAgent storeAgent) {
        return super.canRun(storeAgent) && marketplaceMapper.countActiveByStore(storeAgent.getStoreId()) > 0;
    }

    @Override
    public Duration getCadence(StoreAgent storeAgent) {
        return Duration.ofHours(config(storeAgent).getInt("update_frequency_hours"));
    }

    @Override
    public List<String> getSubscribedEvents() {
        return List.of("competitor.price_changed", "product.cost_updated", "listing.buy_box_lost");
    }

    @Override
    public EventReaction handleEvent(String event, Map<String, Object> payload, StoreAgent storeAgent) {
        Map<String, Object> scope = new LinkedHashMap<>();
        if (PayloadValues.has(payload, "listing_id")) {
            scope.put("listing_id", PayloadValues.longValue(payload, "listing_id"));
        } else if (PayloadValues.has(payload, "product_id")) {
            scope.put("product_id", PayloadValues.longValue(payload, "product_id"));
        }
        return EventReaction.run(scope);
    }

    @Override
    public AgentRunResult run(AgentRun run, StoreAgent storeAgent) {
        AgentConfig config = config(storeAgent);
        Map<String, Object> scope = triggerScope(run);
        List<String> platforms = config.getStringList("enabled_platforms").stream()
                .map(platform -> platform.toLowerCase(Locale.ROOT))
                .toList();
        List<StoreMarketplace> marketplaces = marketplaceMapper.listActiveByStore(storeAgent.getStoreId()).stream()
                .filter(marketplace -> marketplace.getPlatform() != null
                        && platforms.contains(marketplace.getPlatform().toLowerCase(Locale.ROOT)))
                .toList();

        int analyzed = 0;
        int proposed = 0;
        int marginProtected = 0;
        int buyBoxOptimizations = 0;
        Map<String, Object> byPlatform = new LinkedHashMap<>();
        for (StoreMarketplace marketplace : marketplaces) {
            String platform = marketplace.getPlatform().toLowerCase(Locale.ROOT);
            Map<String, Object> platformResult = new LinkedHashMap<>();
            int platformAnalyzed = 0;
            int platformChanges = 0;
            List<Map<String, Object>> listingErrors = new ArrayList<>();
            try {
                PlatformConnector connector = connectorManager.connectorFor(marketplace);
                for (PlatformListing listing : listingMapper.listActiveByMarketplace(marketplace.getId(),
                        config.getInt("max_items_per_run"))) {
                    if (!inScope(listing, scope)) {
                        continue;
                    }
                    platformAnalyzed++;
                    analyzed++;
                    try {
                        Repricing repricing = calculate(listing, platform, connector, config);
                        if (repricing == null) {
                            continue;
                        }
                        if (propose(run, storeAgent, toProposal(listing, platform, repricing, config))) {
                            platformChanges++;
                            proposed++;
                            if (repricing.marginProtected()) {
                                marginProtected++;
                            }
                            if (repricing.buyBoxOptimized()) {
                                buyBoxOptimizations++;
                            }
                        }
                    } catch (RuntimeException e) {
                        log.warn("Repricing listing failed storeId={} listingId={}: {}",
                                storeAgent.getStoreId(), listing.getId(), e.getMessage());
                        Map<String, Object> failure = new LinkedHashMap<>();
                        failure.put("listing_id", listing.getId());
                        failure.put("error", e.getMessage());
                        listingErrors.add(failure);
                    }
                }
            } catch (RuntimeException e) {
                log.warn("Repricing failed storeId={} marketplaceId={}: {}",
                        storeAgent.getStoreId(), marketplace.getId(), e.getMessage());
                platformResult.put("error", e.getMessage());
            }
            platformResult.put("analyzed", platformAnalyzed);
            platformResult.put("changes", platformChanges);
            if (!listingErrors.isEmpty()) {
                platformResult.put("errors", listingErrors);
            }
            byPlatform.put(platform, platformResult);
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("listings_analyzed", analyzed);
        data.put("price_changes_proposed", proposed);
        data.put("by_platform", byPlatform);
        data.put("margin_protected", marginProtected);
        data.put("buy_box_optimizations", buyBoxOptimizations);
        return AgentRunResult.success(data, proposed);
    }

    Repricing calculate(PlatformListing listing, String platform, PlatformConnector connector, AgentConfig config) {
        BigDecimal current = listing.getPlatformPrice();
        BigDecimal base = listing.getProductPrice();
        if (current == null || current.signum() <= 0 || base == null) {
            return null;
        }
        BigDecimal cost = listing.getProductCost() == null ? BigDecimal.ZERO : listing.getProductCost();
        BigDecimal floor = cost.signum() > 0
                ? cost.multiply(BigDecimal.ONE.add(percent(config.getDecimal("min_margin_percent"))))
                : base.multiply(new BigDecimal("0.7"));
        String strategy = config.getString("repricing_strategy");

        CompetitivePricing competitors = CompetitivePricing.empty();
        BigDecimal price = null;
        String reason = null;
        boolean buyBox = false;
        if ("amazon".equals(platform) && config.getBoolean("amazon_buy_box_strategy")) {
            competitors = connector.getCompetitivePricing(listing.getExternalListingId());
            BigDecimal target = competitors.getBuyBoxPrice() != null ? competitors.getBuyBoxPrice() : competitors.getLowestPrice();
            if (target != null) {
                switch (strategy) {
                    case "aggressive" -> {
                        price = current.min(target.subtract(MIN_CHANGE));
                        reason = "Aggressive Buy Box competition";
                    }
                    case "conservative" -> {
                        if (current.compareTo(target.multiply(new BigDecimal("1.05"))) > 0) {
                            price = target;
                            reason = "Conservative Buy Box alignment";
                        }
                    }
                    default -> {
                        if (current.compareTo(target.multiply(new BigDecimal("1.03"))) > 0) {
                            price = target;
                            reason = "Smart Buy Box optimization - price reduction";
                        } else if (current.compareTo(target.multiply(new BigDecimal("0.95"))) < 0) {
                            price = target.multiply(new BigDecimal("0.99"));
                            reason = "Smart Buy Box optimization - price increase";
                        }
                    }
                }
                if (price != null) {
                    price = price.max(floor);
                    buyBox = true;
                }
            }
        } else if ("walmart".equals(platform) && config.getBoolean("walmart_price_parity")) {
            if (current.compareTo(base.multiply(new BigDecimal("1.05"))) > 0) {
                price = base.max(floor);
                reason = "Walmart price parity - reduce to base price";
            } else if (current.compareTo(base.multiply(new BigDecimal("0.90"))) < 0) {
                price = base.multiply(new BigDecimal("0.95"));
                reason = "Walmart price parity - raise toward base price";
            }
        } else if (base.signum() > 0) {
            BigDecimal drift = current.subtract(base).abs().multiply(HUNDRED).divide(base, 4, RoundingMode.HALF_UP);
            if (drift.compareTo(BigDecimal.TEN) > 0) {
                price = base.max(floor);
                reason = "Sync to base price";
            }
        }
        if (price == null) {
            return null;
        }

        boolean marginProtected = false;
        if (price.compareTo(floor) < 0) {
            price = floor;
            reason += " (adjusted to protect minimum margin)";
            marginProtected = true;
        }
        BigDecimal minAllowed = current.multiply(BigDecimal.ONE.subtract(percent(config.getDecimal("max_price_reduction_percent"))));
        if (price.compareTo(minAllowed) < 0) {
            price = minAllowed;
            reason += " (limited by max reduction cap)";
        }
        price = price.setScale(2, RoundingMode.HALF_UP);
        if (price.subtract(current).abs().compareTo(MIN_CHANGE) < 0) {
            return null;
        }

        Map<String, Object> marginInfo = null;
        if (cost.signum() > 0) {
            marginInfo = new LinkedHashMap<>();
            marginInfo.put("cost", cost);
            marginInfo.put("current_margin_percent", margin(current, cost));
            marginInfo.put("new_margin_percent", margin(price, cost));
        }
        return new Repricing(price, reason, competitors, marginInfo, marginProtected, buyBox);
    }

    private ProposedAction toProposal(PlatformListing listing, String platform, Repricing repricing, AgentConfig config) {
        BigDecimal current = listing.getPlatformPrice();
        BigDecimal changePercent = repricing.price().subtract(current).abs()
                .multiply(HUNDRED)
                .divide(current, 2, RoundingMode.HALF_UP);
        boolean majorChange = config.getBoolean("require_approval_for_major_changes")
                && changePercent.compareTo(config.getDecimal("major_change_threshold_percent")) >= 0;

        Map<String, Object> competitorData = new LinkedHashMap<>();
        competitorData.put("lowest_price", repricing.competitors().getLowestPrice());
        competitorData.put("buy_box_price", repricing.competitors().getBuyBoxPrice());
        competitorData.put("average_price", repricing.competitors().getAveragePrice());
        competitorData.put("seller_count", repricing.competitors().getSellerCount());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("platform", platform);
        payload.put("listing_id", listing.getId());
        payload.put("product_id", listing.getProductId());
        payload.put("product_title", listing.getProductTitle());
        payload.put("current_price", current);
        payload.put("new_price", repricing.price());
        payload.put("change_percent", changePercent);
        payload.put("reason", repricing.reason());
        payload.put("competitor_data", competitorData);
        payload.put("margin_info", repricing.marginInfo());
        payload.put("major_change", majorChange);
        return ProposedAction.builder()
                .actionType(ActionTypes.CHANNEL_REPRICE)
                .targetType(ActionTargets.PLATFORM_LISTING)
                .targetId(String.valueOf(listing.getId()))
                .payload(payload)
                .build();
    }

    private static boolean inScope(PlatformListing listing, Map<String, Object> scope) {
        Long listingId = PayloadValues.longValue(scope, "listing_id");
        if (listingId != null) {
            return listingId.equals(listing.getId());
        }
        Long productId = PayloadValues.longValue(scope, "product_id");
        return productId == null || productId.equals(listing.getProductId());
    }

    private static BigDecimal margin(BigDecimal price, BigDecimal cost) {
        return price.subtract(cost).multiply(HUNDRED).divide(price, 2, RoundingMode.HALF_UP);
    }

    private static BigDecimal percent(BigDecimal value) {
        return value.divide(HUNDRED, 4, RoundingMode.HALF_UP);
    }

    record Repricing(BigDecimal price,
                     String reason,
                     CompetitivePricing competitors,
                     Map<String, Object> marginInfo,
                     boolean marginProtected,
                     boolean buyBoxOptimized) {
    }
}
