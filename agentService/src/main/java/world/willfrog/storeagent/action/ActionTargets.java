package world.willfrog.storeagent.action;

/**
 * Entity kinds an AgentAction can point at.
 */
public final class ActionTargets {

    public static final String PRODUCT = "product";
    public static final String PLATFORM_LISTING = "platform_listing";
    public static final String STORE_MARKETPLACE = "store_marketplace";
    /** customerId:itemKey, one match of a new item to a customer */
    public static final String CUSTOMER_ITEM = "customer_item";
    /** marketplaceId:externalOrderId, for orders not imported yet */
    public static final String EXTERNAL_ORDER = "external_order";
    /** productId:marketplaceId, for listings not created yet */
    public static final String PRODUCT_ON_MARKETPLACE = "product_marketplace";

    private ActionTargets() {
    }

    public static String externalOrderKey(Long marketplaceId, String externalOrderId) {
        return marketplaceId + ":" + externalOrderId;
    }

    public static String customerItemKey(Long customerId, String itemKey) {
        return customerId + ":" + itemKey;
    }

    public static String productOnMarketplaceKey(Long productId, Long marketplaceId) {
        return productId + ":" + marketplaceId;
    }
}
