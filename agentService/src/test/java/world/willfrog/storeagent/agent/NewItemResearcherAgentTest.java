package world.willfrog.storeagent.agent;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import world.willfrog.storeagent.action.ActionTargets;
import world.willfrog.storeagent.action.ProposedAction;
import world.willfrog.storeagent.entity.AgentAction;
import world.willfrog.storeagent.entity.AgentRun;
import world.willfrog.storeagent.entity.Customer;
import world.willfrog.storeagent.entity.Product;
import world.willfrog.storeagent.entity.StoreAgent;
import world.willfrog.storeagent.exception.ExternalServiceException;
import world.willfrog.storeagent.integration.PriceIntelligenceService;
import world.willfrog.storeagent.mapper.CustomerMapper;
import world.willfrog.storeagent.mapper.ProductMapper;
import world.willfrog.storeagent.service.ActionProposalService;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class NewItemResearcherAgentTest {

    @Mock
    private CustomerMapper customerMapper;
    @Mock
    private ProductMapper productMapper;
    @Mock
    private PriceIntelligenceService priceIntelligence;
    @Mock
    private ActionProposalService proposalService;

    private NewItemResearcherAgent agent;
    private StoreAgent storeAgent;

    @BeforeEach
    void setUp() {
        agent = new NewItemResearcherAgent(AgentFixtures.support(proposalService), customerMapper, productMapper,
                priceIntelligence);
        storeAgent = AgentFixtures.storeAgent(1L, NewItemResearcherAgent.SLUG, null);
    }

    @Test
    void handleEvent_productCreated_shouldScopeRunToProduct() {
        Product product = new Product();
        product.setId(77L);
        product.setTitle("Signed jersey");
        product.setCategoryId(5L);
        product.setCategoryName("Sports");
        when(productMapper.findById(77L)).thenReturn(product);

        EventReaction reaction = agent.handleEvent(NewItemResearcherAgent.PRODUCT_CREATED, Map.of("product_id", 77), storeAgent);

        assertThat(reaction.isRunRequested()).isTrue();
        assertThat(reaction.getScope()).containsEntry("item_key", "product:77").containsEntry("category_id", 5L);
    }

    @Test
    void handleEvent_itemWithoutCategory_shouldIgnore() {
        EventReaction reaction = agent.handleEvent(NewItemResearcherAgent.ITEM_READY,
                Map.of("transaction_item_id", 9, "title", "Box of comics"), storeAgent);

        assertThat(reaction.isRunRequested()).isFalse();
        assertThat(reaction.getReason()).isEqualTo("item has no category to match on");
    }

    @Test
    void run_withoutScope_shouldSkip() {
        AgentRunResult result = agent.run(AgentFixtures.run(1L, NewItemResearcherAgent.SLUG), storeAgent);

        assertThat(result.isSkipped()).isTrue();
        verifyNoInteractions(customerMapper, priceIntelligence);
    }

    @Test
    void run_whenMarketDataFails_shouldStillNotifyMatchedCustomers() {
        AgentRun run = AgentFixtures.eventRun(1L, NewItemResearcherAgent.SLUG,
                Map.of("item_key", "transaction_item:9", "title", "Box of comics", "category_id", 5));
        Customer customer = new Customer();
        customer.setId(301L);
        customer.setFirstName("Sam");
        customer.setEmail("sam@example.com");
        customer.setPurchaseCount(4);
        when(customerMapper.listByCategoryAffinity(1L, 5L, 1, 10)).thenReturn(List.of(customer));
        when(priceIntelligence.marketSummary(eq(1L), any())).thenThrow(new ExternalServiceException("price-search", "HTTP 500"));
        ArgumentCaptor<ProposedAction> captor = ArgumentCaptor.forClass(ProposedAction.class);
        when(proposalService.propose(eq(run), eq(storeAgent), captor.capture())).thenReturn(Optional.of(new AgentAction()));

        AgentRunResult result = agent.run(run, storeAgent);

        assertThat(result.getActionsCreated()).isEqualTo(1);
        assertThat(result.getData()).containsEntry("market_data", null).containsEntry("customers_matched", 1);
        ProposedAction proposal = captor.getValue();
        assertThat(proposal.getTargetType()).isEqualTo(ActionTargets.CUSTOMER_ITEM);
        assertThat(proposal.getTargetId()).isEqualTo("301:transaction_item:9");
        assertThat(proposal.getPayload())
                .containsEntry("recipient", "sam@example.com")
                .doesNotContainKey("market_data");
        assertThat((String) proposal.getPayload().get("message")).startsWith("Hi Sam, we just got in Box of comics.");
    }

    @Test
    void run_forTwoNewItems_shouldTargetEachCustomerItemMatchSeparately() {
        Customer customer = new Customer();
        customer.setId(301L);
        customer.setFirstName("Sam");
        customer.setEmail("sam@example.com");
        StoreAgent noMarketData = AgentFixtures.storeAgent(1L, NewItemResearcherAgent.SLUG,
                "{\"include_market_data\":false}");
        when(customerMapper.listByCategoryAffinity(1L, 5L, 1, 10)).thenReturn(List.of(customer));
        ArgumentCaptor<ProposedAction> captor = ArgumentCaptor.forClass(ProposedAction.class);
        when(proposalService.propose(any(AgentRun.class), eq(noMarketData), captor.capture()))
                .thenReturn(Optional.of(new AgentAction()));

        agent.run(AgentFixtures.eventRun(1L, NewItemResearcherAgent.SLUG,
                Map.of("item_key", "transaction_item:9", "title", "Box of comics", "category_id", 5)), noMarketData);
        agent.run(AgentFixtures.eventRun(1L, NewItemResearcherAgent.SLUG,
                Map.of("item_key", "product:77", "title", "Signed jersey", "category_id", 5)), noMarketData);

        assertThat(captor.getAllValues())
                .extracting(ProposedAction::getTargetId)
                .containsExactly("301:transaction_item:9", "301:product:77");
        verifyNoInteractions(priceIntelligence);
    }
}
