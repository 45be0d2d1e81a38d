package world.willfrog.storeagent.agent;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;
import world.willfrog.storeagent.action.ActionTargets;
import world.willfrog.storeagent.action.ActionTypes;
import world.willfrog.storeagent.action.ProposedAction;
import world.willfrog.storeagent.common.util.PayloadValues;
import world.willfrog.storeagent.entity.AgentRun;
import world.willfrog.storeagent.entity.Customer;
import world.willfrog.storeagent.entity.Product;
import world.willfrog.storeagent.entity.StoreAgent;
import world.willfrog.storeagent.exception.ExternalServiceException;
import world.willfrog.storeagent.integration.MarketSummary;
import world.willfrog.storeagent.integration.PriceIntelligenceService;
import world.willfrog.storeagent.integration.PriceSearchCriteria;
import world.willfrog.storeagent.mapper.CustomerMapper;
import world.willfrog.storeagent.mapper.ProductMapper;
import world.willfrog.storeagent.model.AgentType;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Matches newly acquired inventory against customers who bought from the same category and proposes a
 * notification to the top matches. Works on the item handed over by the triggering event only.
 */
@Slf4j
@Component
public class NewItemResearcherAgent extends AbstractAgent {

    static final String SLUG = "new-item-researcher";

    static final String ITEM_READY = "transaction_item.ready_for_inventory";
    static final String PRODUCT_CREATED = "product.created";

    private final CustomerMapper customerMapper;
    private final ProductMapper productMapper;
    private final PriceIntelligenceService priceIntelligence;

    public NewItemResearcherAgent(AgentSupport support,
                                  CustomerMapper customerMapper,
                                  ProductMapper productMapper,
                                  PriceIntelligenceService priceIntelligence) {
        super(support);
        this.customerMapper = customerMapper;
        this.productMapper = productMapper;
        this.priceIntelligence = priceIntelligence;
    }

    @Override
    public String getSlug() {
        return SLUG;
    }

    @Override
    public String getName() {
        return "New Item Researcher";
    }

    @Override
    public String getDescription() {
        return "Notifies customers with matching interests when new inventory arrives";
    }

    @Override
    public AgentType getType() {
        return AgentType.EVENT_TRIGGERED;
    }

    @Override
    public Map<String, Object> getDefaultConfig() {
        Map<String, Object> defaults = new LinkedHashMap<>();
        defaults.put("max_matches", 10);
        defaults.put("min_purchase_count", 1);
        defaults.put("notification_channel", "email");
        defaults.put("include_market_data", true);
        return defaults;
    }

    @Override
    public Map<String, ConfigField> getConfigSchema() {
        Map<String, ConfigField> schema = new LinkedHashMap<>();
        schema.put("max_matches", ConfigField.number("Max Matches", "Customers notified per item", 1, 100));
        schema.put("min_purchase_count", ConfigField.number("Minimum Purchases",
                "Past purchases in the category needed to match", 1, 100));
        schema.put("notification_channel", ConfigField.select("Channel", "How matched customers are contacted",
                Map.of("email", "Email", "sms", "SMS")));
        schema.put("include_market_data", ConfigField.bool("Market Data", "Look up market prices for the item"));
        return schema;
    }

    @Override
    public List<String> getSubscribedEvents() {
        return List.of(ITEM_READY, PRODUCT_CREATED);
    }

    @Override
    public EventReaction handleEvent(String event, Map<String, Object> payload, StoreAgent storeAgent) {
        Map<String, Object> item = new LinkedHashMap<>();
        if (PRODUCT_CREATED.equals(event)) {
            Long productId = PayloadValues.longValue(payload, "product_id");
            Product product = productId == null ? null : productMapper.findById(productId);
            if (product == null) {
                return EventReaction.ignore("product not found");
            }
            item.put("item_key", "product:" + product.getId());
            item.put("title", product.getTitle());
            item.put("category_id", product.getCategoryId());
            item.put("category_name", product.getCategoryName());
            item.put("brand", product.getBrand());
            item.put("condition", product.getCondition());
        } else {
            Long itemId = PayloadValues.longValue(payload, "transaction_item_id");
            if (itemId == null) {
                return EventReaction.ignore("event carries no transaction_item_id");
            }
            String title = PayloadValues.string(payload, "title");
            item.put("item_key", "transaction_item:" + itemId);
            item.put("title", title != null ? title : StringUtils.left(PayloadValues.string(payload, "description"), 50));
            item.put("category_id", PayloadValues.longValue(payload, "category_id"));
            item.put("category_name", PayloadValues.string(payload, "category_name"));
            item.put("brand", PayloadValues.string(payload, "brand"));
            item.put("condition", PayloadValues.string(payload, "condition"));
        }
        if (item.get("category_id") == null) {
            return EventReaction.ignore("item has no category to match on");
        }
        return EventReaction.run(item);
    }

    @Override
    public AgentRunResult run(AgentRun run, StoreAgent storeAgent) {
        Map<String, Object> item = triggerScope(run);
        Long categoryId = PayloadValues.longValue(item, "category_id");
        if (categoryId == null) {
            return AgentRunResult.skipped("no new item in scope");
        }
        AgentConfig config = config(storeAgent);
        List<Customer> customers = customerMapper.listByCategoryAffinity(storeAgent.getStoreId(), categoryId,
                config.getInt("min_purchase_count"), config.getInt("max_matches"));
        Map<String, Object> market = config.getBoolean("include_market_data") ? marketData(storeAgent.getStoreId(), item) : null;

        int proposed = 0;
        for (Customer customer : customers) {
            if (propose(run, storeAgent, notification(customer, item, market, config.getString("notification_channel")))) {
                proposed++;
            }
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("item_key", item.get("item_key"));
        data.put("customers_matched", customers.size());
        data.put("notifications_created", proposed);
        data.put("market_data", market);
        return AgentRunResult.success(data, proposed);
    }

    private Map<String, Object> marketData(Long storeId, Map<String, Object> item) {
        PriceSearchCriteria criteria = PriceSearchCriteria.builder()
                .title(PayloadValues.string(item, "title"))
                .category(PayloadValues.string(item, "category_name"))
                .brand(PayloadValues.string(item, "brand"))
                .condition(PayloadValues.string(item, "condition"))
                .attributes(Map.of())
                .build();
        try {
            MarketSummary summary = priceIntelligence.marketSummary(storeId, criteria);
            Map<String, Object> market = new LinkedHashMap<>();
            market.put("median", summary.getMedian());
            market.put("min", summary.getMin());
            market.put("max", summary.getMax());
            market.put("sample_size", summary.getCount());
            return market;
        } catch (ExternalServiceException e) {
            log.info("Market data unavailable for item {}: {}", item.get("item_key"), e.getMessage());
            return null;
        }
    }

    private static ProposedAction notification(Customer customer, Map<String, Object> item,
                                               Map<String, Object> market, String channel) {
        String title = PayloadValues.string(item, "title");
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", "new_item_match");
        payload.put("channel", channel);
        payload.put("customer_id", customer.getId());
        payload.put("recipient", "sms".equals(channel) ? customer.getPhone() : customer.getEmail());
        payload.put("subject", "New Item You Might Like");
        payload.put("message", String.format("Hi %s, we just got in %s. Based on your past purchases we thought "
                        + "you might be interested.",
                StringUtils.defaultIfBlank(customer.getFirstName(), "there"), StringUtils.defaultIfBlank(title, "a new item")));
        payload.put("item_key", item.get("item_key"));
        payload.put("purchase_count", customer.getPurchaseCount());
        if (market != null) {
            payload.put("market_data", market);
        }
        payload.put("reasoning", "Customer has previously purchased items in the same category.");
        return ProposedAction.builder()
                .actionType(ActionTypes.SEND_NOTIFICATION)
                .targetType(ActionTargets.CUSTOMER_ITEM)
                .targetId(ActionTargets.customerItemKey(customer.getId(), PayloadValues.string(item, "item_key")))
                .payload(payload)
                .build();
    }
}
