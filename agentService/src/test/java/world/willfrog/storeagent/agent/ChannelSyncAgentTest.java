package world.willfrog.storeagent.agent;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import world.willfrog.storeagent.action.ActionTargets;
import world.willfrog.storeagent.action.ActionTypes;
import world.willfrog.storeagent.action.ProposedAction;
import world.willfrog.storeagent.common.util.PayloadValues;
import world.willfrog.storeagent.entity.AgentAction;
import world.willfrog.storeagent.entity.PlatformListing;
import world.willfrog.storeagent.entity.PlatformOrder;
import world.willfrog.storeagent.entity.StoreAgent;
import world.willfrog.storeagent.entity.StoreMarketplace;
import world.willfrog.storeagent.exception.ValidationException;
import world.willfrog.storeagent.integration.ExternalOrder;
import world.willfrog.storeagent.integration.PlatformConnector;
import world.willfrog.storeagent.integration.PlatformConnectorManager;
import world.willfrog.storeagent.mapper.PlatformListingMapper;
import world.willfrog.storeagent.mapper.PlatformOrderMapper;
import world.willfrog.storeagent.mapper.StoreMarketplaceMapper;
import world.willfrog.storeagent.service.ActionProposalService;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ChannelSyncAgentTest {

    @Mock
    private StoreMarketplaceMapper marketplaceMapper;
    @Mock
    private PlatformListingMapper listingMapper;
    @Mock
    private PlatformOrderMapper orderMapper;
    @Mock
    private PlatformConnectorManager connectorManager;
    @Mock
    private PlatformConnector connector;
    @Mock
    private ActionProposalService proposalService;

    private ChannelSyncAgent agent;
    private StoreMarketplace ebay;

    @BeforeEach
    void setUp() {
        agent = new ChannelSyncAgent(AgentFixtures.support(proposalService), marketplaceMapper, listingMapper,
                orderMapper, connectorManager);
        ebay = new StoreMarketplace();
        ebay.setId(3L);
        ebay.setStoreId(1L);
        ebay.setPlatform("ebay");
        ebay.setActive(true);
    }

    @Test
    void run_shouldBatchAllQuantityChangesOfOneMarketplaceIntoOneAction() {
        StoreAgent storeAgent = AgentFixtures.storeAgent(1L, ChannelSyncAgent.SLUG,
                "{\"inventory_buffer\":2,\"sync_orders\":false}");
        List<PlatformListing> listings = new ArrayList<>();
        for (long i = 1; i <= 10; i++) {
            listings.add(listing(i, 5, 5));
        }
        when(marketplaceMapper.listActiveByStore(1L)).thenReturn(List.of(ebay));
        when(listingMapper.listActiveByMarketplace(eq(3L), anyInt())).thenReturn(listings);
        ArgumentCaptor<ProposedAction> captor = ArgumentCaptor.forClass(ProposedAction.class);
        when(proposalService.propose(any(), any(), captor.capture())).thenReturn(Optional.of(new AgentAction()));

        AgentRunResult result = agent.run(AgentFixtures.run(1L, ChannelSyncAgent.SLUG), storeAgent);

        verify(proposalService, times(1)).propose(any(), any(), any());
        ProposedAction proposal = captor.getValue();
        assertThat(proposal.getActionType()).isEqualTo(ActionTypes.SYNC_INVENTORY);
        assertThat(proposal.getTargetType()).isEqualTo(ActionTargets.STORE_MARKETPLACE);
        assertThat(proposal.getTargetId()).isEqualTo("3");
        List<Map<String, Object>> updates = PayloadValues.mapList(proposal.getPayload(), "updates");
        assertThat(updates).hasSize(10);
        assertThat(updates).allSatisfy(update -> assertThat(update).containsEntry("new_quantity", 3));
        assertThat(result.getActionsCreated()).isEqualTo(1);
        assertThat(result.getData()).containsEntry("inventory_synced", 10).containsEntry("low_stock_alerts", 10);
    }

    @Test
    void run_whenQuantitiesAlreadyMatch_shouldProposeNothing() {
        StoreAgent storeAgent = AgentFixtures.storeAgent(1L, ChannelSyncAgent.SLUG, "{\"sync_orders\":false}");
        when(marketplaceMapper.listActiveByStore(1L)).thenReturn(List.of(ebay));
        when(listingMapper.listActiveByMarketplace(eq(3L), anyInt())).thenReturn(List.of(listing(1L, 5, 3)));

        AgentRunResult result = agent.run(AgentFixtures.run(1L, ChannelSyncAgent.SLUG), storeAgent);

        assertThat(result.getActionsCreated()).isZero();
        verify(proposalService, never()).propose(any(), any(), any());
    }

    @Test
    void run_whenListingSellsOut_shouldAlsoProposeNotification() {
        StoreAgent storeAgent = AgentFixtures.storeAgent(1L, ChannelSyncAgent.SLUG, "{\"sync_orders\":false}");
        when(marketplaceMapper.listActiveByStore(1L)).thenReturn(List.of(ebay));
        when(listingMapper.listActiveByMarketplace(eq(3L), anyInt())).thenReturn(List.of(listing(1L, 1, 4)));
        ArgumentCaptor<ProposedAction> captor = ArgumentCaptor.forClass(ProposedAction.class);
        when(proposalService.propose(any(), any(), captor.capture())).thenReturn(Optional.of(new AgentAction()));

        AgentRunResult result = agent.run(AgentFixtures.run(1L, ChannelSyncAgent.SLUG), storeAgent);

        assertThat(captor.getAllValues()).extracting(ProposedAction::getActionType)
                .containsExactly(ActionTypes.SEND_NOTIFICATION, ActionTypes.SYNC_INVENTORY);
        assertThat(result.getData()).containsEntry("out_of_stock", 1);
    }

    @Test
    void run_shouldProposeOneSyncOrderPerUnseenOrder() {
        StoreAgent storeAgent = AgentFixtures.storeAgent(1L, ChannelSyncAgent.SLUG, "{\"sync_inventory\":false}");
        when(marketplaceMapper.listActiveByStore(1L)).thenReturn(List.of(ebay));
        when(listingMapper.listActiveByMarketplace(eq(3L), anyInt())).thenReturn(List.of());
        when(connectorManager.connectorFor(ebay)).thenReturn(connector);
        when(connector.getOrders(any(OffsetDateTime.class))).thenReturn(List.of(order("EXT-1"), order("EXT-2")));
        when(orderMapper.findByExternalId(3L, "EXT-1")).thenReturn(new PlatformOrder());
        when(orderMapper.findByExternalId(3L, "EXT-2")).thenReturn(null);
        ArgumentCaptor<ProposedAction> captor = ArgumentCaptor.forClass(ProposedAction.class);
        when(proposalService.propose(any(), any(), captor.capture())).thenReturn(Optional.of(new AgentAction()));

        AgentRunResult result = agent.run(AgentFixtures.run(1L, ChannelSyncAgent.SLUG), storeAgent);

        assertThat(captor.getAllValues()).hasSize(1);
        assertThat(captor.getValue().getActionType()).isEqualTo(ActionTypes.SYNC_ORDER);
        assertThat(captor.getValue().getTargetId()).isEqualTo("3:EXT-2");
        assertThat(result.getData()).containsEntry("orders_imported", 1);
    }

    @Test
    void run_whenOneOrderIsRejected_shouldRecordItAndImportTheRest() {
        StoreAgent storeAgent = AgentFixtures.storeAgent(1L, ChannelSyncAgent.SLUG, "{\"sync_inventory\":false}");
        when(marketplaceMapper.listActiveByStore(1L)).thenReturn(List.of(ebay));
        when(listingMapper.listActiveByMarketplace(eq(3L), anyInt())).thenReturn(List.of());
        when(connectorManager.connectorFor(ebay)).thenReturn(connector);
        when(connector.getOrders(any(OffsetDateTime.class))).thenReturn(List.of(order("EXT-1"), order("EXT-2")));
        when(proposalService.propose(any(), any(), any()))
                .thenThrow(new ValidationException("invalid payload for sync_order"))
                .thenReturn(Optional.of(new AgentAction()));

        AgentRunResult result = agent.run(AgentFixtures.run(1L, ChannelSyncAgent.SLUG), storeAgent);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getData()).containsEntry("orders_imported", 1);
        @SuppressWarnings("unchecked")
        List<String> errors = (List<String>) result.getData().get("errors");
        assertThat(errors).containsExactly("ebay: order EXT-1: invalid payload for sync_order");
    }

    @Test
    void run_whenOrderFetchFails_shouldKeepInventoryResultAndRecordError() {
        StoreAgent storeAgent = AgentFixtures.storeAgent(1L, ChannelSyncAgent.SLUG, "{}");
        when(marketplaceMapper.listActiveByStore(1L)).thenReturn(List.of(ebay));
        when(listingMapper.listActiveByMarketplace(eq(3L), anyInt())).thenReturn(List.of(listing(1L, 9, 9)));
        when(connectorManager.connectorFor(ebay)).thenReturn(connector);
        when(connector.getOrders(any(OffsetDateTime.class))).thenThrow(new IllegalStateException("HTTP 503"));
        when(proposalService.propose(any(), any(), any())).thenReturn(Optional.of(new AgentAction()));

        AgentRunResult result = agent.run(AgentFixtures.run(1L, ChannelSyncAgent.SLUG), storeAgent);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getData()).containsEntry("inventory_synced", 1);
        @SuppressWarnings("unchecked")
        List<String> errors = (List<String>) result.getData().get("errors");
        assertThat(errors).containsExactly("ebay: orders: HTTP 503");
    }

    @Test
    void handleEvent_whenInventoryEventHasNoProduct_shouldIgnore() {
        StoreAgent storeAgent = AgentFixtures.storeAgent(1L, ChannelSyncAgent.SLUG, null);

        EventReaction ignored = agent.handleEvent("product.inventory_updated", Map.of(), storeAgent);
        EventReaction scoped = agent.handleEvent("product.inventory_updated", Map.of("product_id", 9), storeAgent);

        assertThat(ignored.isRunRequested()).isFalse();
        assertThat(scoped.isRunRequested()).isTrue();
        assertThat(scoped.getScope()).containsEntry("product_id", 9L);
    }

    @Test
    void canRun_shouldRequireAnActiveMarketplace() {
        StoreAgent storeAgent = AgentFixtures.storeAgent(1L, ChannelSyncAgent.SLUG, null);
        when(marketplaceMapper.countActiveByStore(1L)).thenReturn(0);

        assertThat(agent.canRun(storeAgent)).isFalse();
    }

    private static PlatformListing listing(Long id, int productQuantity, int platformQuantity) {
        PlatformListing listing = new PlatformListing();
        listing.setId(id);
        listing.setProductId(id + 100);
        listing.setMarketplaceId(3L);
        listing.setSku("SKU-" + id);
        listing.setExternalListingId("EB-" + id);
        listing.setProductTitle("Item " + id);
        listing.setProductQuantity(productQuantity);
        listing.setPlatformQuantity(platformQuantity);
        listing.setProductPrice(new BigDecimal("20.00"));
        listing.setPlatformPrice(new BigDecimal("20.00"));
        listing.setStatus("active");
        return listing;
    }

    private static ExternalOrder order(String externalId) {
        return ExternalOrder.builder()
                .externalId(externalId)
                .status("paid")
                .total(new BigDecimal("42.00"))
                .lineItems(List.of())
                .build();
    }
}
