package world.willfrog.storeagent.action;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import world.willfrog.storeagent.common.util.PayloadValues;
import world.willfrog.storeagent.entity.AgentAction;
import world.willfrog.storeagent.entity.StoreMarketplace;
import world.willfrog.storeagent.integration.PlatformConnector;
import world.willfrog.storeagent.integration.PlatformConnectorManager;
import world.willfrog.storeagent.mapper.PlatformListingMapper;
import world.willfrog.storeagent.mapper.StoreMarketplaceMapper;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SyncInventoryActionTest {

    @Mock
    private StoreMarketplaceMapper marketplaceMapper;
    @Mock
    private PlatformListingMapper listingMapper;
    @Mock
    private PlatformConnectorManager connectorManager;
    @Mock
    private PlatformConnector connector;

    private SyncInventoryAction handler;
    private StoreMarketplace marketplace;

    @BeforeEach
    void setUp() {
        handler = new SyncInventoryAction(marketplaceMapper, listingMapper, connectorManager);
        marketplace = new StoreMarketplace();
        marketplace.setId(3L);
        marketplace.setPlatform("shopify");
    }

    @Test
    void execute_whenOneSkuRejected_shouldSucceedAndOnlyMoveAcceptedListing() {
        when(marketplaceMapper.findById(3L)).thenReturn(marketplace);
        when(connectorManager.connectorFor(marketplace)).thenReturn(connector);
        when(connector.bulkUpdateInventory(anyList())).thenReturn(Map.of("ABC", false, "XYZ", true));

        ActionResult result = handler.execute(action(), payload());

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getMessage()).contains("1 successful, 1 failed");
        verify(listingMapper).updateQuantity(eq(12L), eq(4), any(OffsetDateTime.class));
        verify(listingMapper, never()).updateQuantity(eq(11L), anyInt(), any(OffsetDateTime.class));
        List<Map<String, Object>> before = PayloadValues.mapList(result.getBefore(), "listings");
        assertThat(before).hasSize(1);
        assertThat(before.get(0)).containsEntry("sku", "XYZ").containsEntry("quantity", 7);
    }

    @Test
    void execute_whenEverySkuRejected_shouldFail() {
        when(marketplaceMapper.findById(3L)).thenReturn(marketplace);
        when(connectorManager.connectorFor(marketplace)).thenReturn(connector);
        when(connector.bulkUpdateInventory(anyList())).thenReturn(Map.of("ABC", false, "XYZ", false));

        ActionResult result = handler.execute(action(), payload());

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getMessage()).isEqualTo("0 successful, 2 failed");
        verify(marketplaceMapper, never()).touchSync(anyLong(), any());
    }

    @Test
    void validatePayload_shouldRequireSkuAndQuantityOnEveryUpdate() {
        Map<String, Object> missingQuantity = new LinkedHashMap<>(payload());
        missingQuantity.put("updates", List.of(Map.of("sku", "ABC")));

        assertThat(handler.validatePayload(payload())).isTrue();
        assertThat(handler.validatePayload(missingQuantity)).isFalse();
        assertThat(handler.validatePayload(Map.of("marketplace_id", 3, "updates", List.of()))).isFalse();
    }

    @Test
    void rollback_shouldPushPreviousQuantities() {
        when(marketplaceMapper.findById(3L)).thenReturn(marketplace);
        when(connectorManager.connectorFor(marketplace)).thenReturn(connector);
        when(connector.bulkUpdateInventory(anyList())).thenReturn(Map.of("XYZ", true));
        Map<String, Object> result = Map.of("before", Map.of("listings",
                List.of(Map.of("listing_id", 12, "sku", "XYZ", "external_id", "X-2", "quantity", 7))));

        boolean applied = handler.rollback(action(), payload(), result);

        assertThat(applied).isTrue();
        verify(listingMapper).updateQuantity(eq(12L), eq(7), any(OffsetDateTime.class));
    }

    private static AgentAction action() {
        AgentAction action = new AgentAction();
        action.setId(9L);
        action.setActionType(ActionTypes.SYNC_INVENTORY);
        action.setTargetType(ActionTargets.STORE_MARKETPLACE);
        action.setTargetId("3");
        return action;
    }

    private static Map<String, Object> payload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("marketplace_id", 3);
        payload.put("platform", "shopify");
        payload.put("updates", List.of(
                Map.of("listing_id", 11, "sku", "ABC", "external_id", "X-1", "old_quantity", 2, "new_quantity", 1),
                Map.of("listing_id", 12, "sku", "XYZ", "external_id", "X-2", "old_quantity", 7, "new_quantity", 4)));
        return payload;
    }
}
