package world.willfrog.storeagent.action;

public final class ActionTypes {

    public static final String PRICE_UPDATE = "price_update";
    public static final String SYNC_INVENTORY = "sync_inventory";
    public static final String SYNC_PRICING = "sync_pricing";
    public static final String CREATE_LISTING = "create_listing";
    public static final String UPDATE_LISTING = "update_listing";
    public static final String SYNC_ORDER = "sync_order";
    public static final String SEND_NOTIFICATION = "send_notification";
    public static final String CHANNEL_REPRICE = "channel_reprice";
    public static final String MARKDOWN_SCHEDULE = "markdown_schedule";

    private ActionTypes() {
    }
}
