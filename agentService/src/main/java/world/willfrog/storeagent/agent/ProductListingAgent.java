package world.willfrog.storeagent.agent;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import world.willfrog.storeagent.action.ActionTargets;
import world.willfrog.storeagent.action.ActionTypes;
import world.willfrog.storeagent.action.ProposedAction;
import world.willfrog.storeagent.common.util.PayloadValues;
import world.willfrog.storeagent.entity.AgentRun;
import world.willfrog.storeagent.entity.PlatformListing;
import world.willfrog.storeagent.entity.Product;
import world.willfrog.storeagent.entity.StoreAgent;
import world.willfrog.storeagent.entity.StoreMarketplace;
import world.willfrog.storeagent.integration.ListingTransformer;
import world.willfrog.storeagent.integration.PlatformProduct;
import world.willfrog.storeagent.mapper.PlatformListingMapper;
import world.willfrog.storeagent.mapper.ProductMapper;
import world.willfrog.storeagent.mapper.StoreMarketplaceMapper;
import world.willfrog.storeagent.model.AgentType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Slf4j
@Component
public class ProductListingAgent extends AbstractAgent {

    static final String SLUG = "product-listing";

    private final ProductMapper productMapper;
    private final StoreMarketplaceMapper marketplaceMapper;
    private final PlatformListingMapper listingMapper;
    private final ListingTransformer transformer;

    public ProductListingAgent(AgentSupport support,
                               ProductMapper productMapper,
                               StoreMarketplaceMapper marketplaceMapper,
                               PlatformListingMapper listingMapper,
                               ListingTransformer transformer) {
        super(support);
        this.productMapper = productMapper;
        this.marketplaceMapper = marketplaceMapper;
        this.listingMapper = listingMapper;
        this.transformer = transformer;
    }

    @Override
    public String getSlug() {
        return SLUG;
    }

    @Override
    public String getName() {
        return "Product Listing";
    }

    @Override
    public String getDescription() {
        return "Prepares platform-optimized listings for products not yet listed";
    }

    @Override
    public AgentType getType() {
        return AgentType.REACTIVE;
    }

    @Override
    public Map<String, Object> getDefaultConfig() {
        Map<String, Object> defaults = new LinkedHashMap<>();
        defaults.put("platforms", List.of());
        defaults.put("batch_size", 50);
        defaults.put("require_approval_for_publish", true);
        defaults.put(RUN_FREQUENCY, "daily");
        return defaults;
    }

    @Override
    public Map<String, ConfigField> getConfigSchema() {
        Map<String, ConfigField> schema = new LinkedHashMap<>();
        schema.put("platforms", ConfigField.multiselect("Platforms", "Marketplaces to list on; empty means all connected",
                Map.of("amazon", "Amazon", "walmart", "Walmart", "shopify", "Shopify", "ebay", "eBay", "etsy", "Etsy")));
        schema.put("batch_size", ConfigField.number("Batch Size", "Products prepared per run", 1, 500));
        schema.put("require_approval_for_publish", ConfigField.bool("Approve Before Publishing",
                "Review listings before they go live"));
        schema.put(RUN_FREQUENCY, ConfigField.select("Run Frequency", "How often the agent runs", Cadences.OPTIONS));
        return schema;
    }

    @Override
    public boolean canRun(StoreAgent storeAgent) {
        return super.canRun(storeAgent) && marketplaceMapper.countActiveByStore(storeAgent.getStoreId()) > 0;
    }

    @Override
    public List<String> getSubscribedEvents() {
        return List.of("product.created", "product.updated");
    }

    @Override
    public EventReaction handleEvent(String event, Map<String, Object> payload, StoreAgent storeAgent) {
        Long productId = PayloadValues.longValue(payload, "product_id");
        if (productId == null) {
            return EventReaction.ignore("event carries no product_id");
        }
        return EventReaction.run(Map.of("product_id", productId));
    }

    @Override
    public AgentRunResult run(AgentRun run, StoreAgent storeAgent) {
        AgentConfig config = config(storeAgent);
        Long scopedProduct = PayloadValues.longValue(triggerScope(run), "product_id");
        List<Product> products = scopedProduct == null
                ? productMapper.listListable(storeAgent.getStoreId(), config.getInt("batch_size"))
                : loadScoped(storeAgent.getStoreId(), scopedProduct);
        List<StoreMarketplace> marketplaces = targetMarketplaces(storeAgent.getStoreId(), config.getStringList("platforms"));
        if (products.isEmpty() || marketplaces.isEmpty()) {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("message", "No products found that need listing");
            data.put("products_processed", 0);
            return AgentRunResult.success(data, 0);
        }

        boolean requireApproval = config.getBoolean("require_approval_for_publish");
        int processed = 0;
        int prepared = 0;
        Map<String, Integer> byPlatform = new LinkedHashMap<>();
        List<Map<String, Object>> errors = new ArrayList<>();
        for (Product product : products) {
            processed++;
            for (StoreMarketplace marketplace : marketplaces) {
                try {
                    PlatformListing existing = listingMapper.findByMarketplaceAndProduct(marketplace.getId(), product.getId());
                    boolean refresh = existing != null && (scopedProduct != null || !"active".equals(existing.getStatus()));
                    if (existing != null && !refresh) {
                        continue;
                    }
                    ProposedAction proposal = listingProposal(product, marketplace, existing, requireApproval);
                    if (propose(run, storeAgent, proposal)) {
                        prepared++;
                        byPlatform.merge(marketplace.getPlatform(), 1, Integer::sum);
                    }
                } catch (RuntimeException e) {
                    log.warn("Listing preparation failed productId={} marketplaceId={}: {}",
                            product.getId(), marketplace.getId(), e.getMessage());
                    Map<String, Object> error = entityError("product_id", product.getId(), e);
                    error.put("platform", marketplace.getPlatform());
                    errors.add(error);
                }
            }
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("products_processed", processed);
        data.put("listings_prepared", prepared);
        data.put("by_platform", byPlatform);
        if (!errors.isEmpty()) {
            data.put("errors", errors);
        }
        return AgentRunResult.success(data, prepared);
    }

    private ProposedAction listingProposal(Product product, StoreMarketplace marketplace, PlatformListing existing,
                                           boolean requireApproval) {
        PlatformProduct transformed = transformer.transform(product, marketplace.getPlatform());
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("platform", marketplace.getPlatform());
        payload.put("marketplace_id", marketplace.getId());
        payload.put("product_id", product.getId());
        payload.put("existing_listing_id", existing == null ? null : existing.getId());
        payload.put("transformed_product", support.getJson().mapper().convertValue(transformed, Map.class));
        payload.put("original_title", product.getTitle());
        payload.put("optimized_title", transformed.getTitle());
        payload.put("require_approval_for_publish", requireApproval);
        payload.put("reasoning", reasoning(product, transformed, marketplace.getPlatform()));
        if (existing != null) {
            return ProposedAction.builder()
                    .actionType(ActionTypes.UPDATE_LISTING)
                    .targetType(ActionTargets.PLATFORM_LISTING)
                    .targetId(String.valueOf(existing.getId()))
                    .payload(payload)
                    .build();
        }
        return ProposedAction.builder()
                .actionType(ActionTypes.CREATE_LISTING)
                .targetType(ActionTargets.PRODUCT_ON_MARKETPLACE)
                .targetId(ActionTargets.productOnMarketplaceKey(product.getId(), marketplace.getId()))
                .payload(payload)
                .build();
    }

    private List<Product> loadScoped(Long storeId, Long productId) {
        Product product = productMapper.findById(productId);
        if (product == null || !storeId.equals(product.getStoreId())) {
            return List.of();
        }
        return List.of(product);
    }

    private List<StoreMarketplace> targetMarketplaces(Long storeId, List<String> platforms) {
        List<String> wanted = platforms.stream().map(platform -> platform.toLowerCase(Locale.ROOT)).toList();
        return marketplaceMapper.listActiveByStore(storeId).stream()
                .filter(marketplace -> wanted.isEmpty()
                        || (marketplace.getPlatform() != null && wanted.contains(marketplace.getPlatform().toLowerCase(Locale.ROOT))))
                .toList();
    }

    private static String reasoning(Product product, PlatformProduct transformed, String platform) {
        if (product.getTitle() != null && !product.getTitle().equals(transformed.getTitle())) {
            return String.format("Title shortened from \"%s\" to \"%s\" to fit %s limits.",
                    product.getTitle(), transformed.getTitle(), platform);
        }
        return "Product prepared for " + platform + " with platform-specific formatting.";
    }
}
