package com.serviceintake.application.service;

import com.serviceintake.domain.exception.FlowFailureException;
import com.serviceintake.domain.exception.FlowStep;
import com.serviceintake.domain.exception.IdentityConflictException;
import com.serviceintake.domain.exception.IdentityValidationException;
import com.serviceintake.domain.exception.ResolutionFailureException;
import com.serviceintake.domain.model.CandidateIdentity;
import com.serviceintake.domain.model.Customer;
import com.serviceintake.domain.model.CustomerResolution;
import com.serviceintake.domain.model.FlowRequest;
import com.serviceintake.domain.model.FlowResult;
import com.serviceintake.domain.model.IdentityKey;
import com.serviceintake.domain.model.IntakeChannel;
import com.serviceintake.domain.model.OrderDetails;
import com.serviceintake.domain.model.OrderType;
import com.serviceintake.domain.model.ServiceOrder;
import com.serviceintake.domain.model.Vehicle;
import com.serviceintake.domain.model.VehicleDetails;
import com.serviceintake.domain.port.CustomerRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TransactionCoordinatorImplTest {

    private static final IdentityKey JANE = new IdentityKey(1, "Jane Doe", "5550100", "", "");

    @Mock
    private CustomerRepository customerRepository;
    @Mock
    private CustomerResolver customerResolver;
    @Mock
    private VehicleResolver vehicleResolver;
    @Mock
    private ServiceOrderCreator orderCreator;
    @Mock
    private VisitTracker visitTracker;
    @Mock
    private TransactionTemplate transactionTemplate;

    private TransactionCoordinatorImpl coordinator;

    private final Customer jane = Customer.builder().id(1L).fullName("Jane Doe").totalVisits(1).build();
    private final ServiceOrder order = ServiceOrder.builder().id(100L).customerId(1L).type(OrderType.SERVICE).build();

    @BeforeEach
    void setUp() {
        PhoneNormalizer phoneNormalizer = new PhoneNormalizer("");
        coordinator = new TransactionCoordinatorImpl(
                new FallbackIdentityPolicy(phoneNormalizer),
                new IdentityMatcher(phoneNormalizer, customerRepository),
                customerResolver,
                vehicleResolver,
                orderCreator,
                visitTracker,
                transactionTemplate);
    }

    @SuppressWarnings("unchecked")
    private void runCallbacksInline() {
        when(transactionTemplate.execute(any())).thenAnswer(invocation ->
                ((TransactionCallback<Object>) invocation.getArgument(0)).doInTransaction(null));
    }

    private FlowRequest janeRequest(VehicleDetails vehicle) {
        return FlowRequest.builder()
                .channel(IntakeChannel.ORDER_INTAKE)
                .customer(CandidateIdentity.builder()
                        .branch(1).fullName("Jane Doe").phone("555-0100").sourceReference("ORD-9").build())
                .vehicle(vehicle)
                .order(OrderDetails.builder().type(OrderType.SERVICE).build())
                .build();
    }

    @Test
    void newCustomerCountsCreationAsTheVisit() {
        runCallbacksInline();
        when(customerResolver.resolveInCurrentTransaction(JANE, true)).thenReturn(CustomerResolution.created(jane));
        when(orderCreator.create(eq(jane), eq(null), any(), eq(IntakeChannel.ORDER_INTAKE), eq("ORD-9")))
                .thenReturn(order);

        FlowResult result = coordinator.createCompleteFlow(janeRequest(null));

        assertThat(result.createdCustomer()).isTrue();
        assertThat(result.customer().getTotalVisits()).isEqualTo(1);
        assertThat(result.vehicle()).isNull();
        assertThat(result.order()).isSameAs(order);
        verify(visitTracker, never()).recordVisit(any());
    }

    @Test
    void existingCustomerGetsExactlyOneVisit() {
        runCallbacksInline();
        Customer visited = jane.toBuilder().totalVisits(2).build();
        Vehicle vehicle = Vehicle.builder().id(8L).customerId(1L).plate("AB123CD").build();
        VehicleDetails details = VehicleDetails.builder().plate("AB123CD").build();
        when(customerResolver.resolveInCurrentTransaction(JANE, true)).thenReturn(CustomerResolution.existing(jane));
        when(vehicleResolver.resolveOrCreate(jane, details)).thenReturn(Optional.of(vehicle));
        when(orderCreator.create(eq(jane), eq(vehicle), any(), any(), any())).thenReturn(order);
        when(visitTracker.recordVisit(jane)).thenReturn(visited);

        FlowResult result = coordinator.createCompleteFlow(janeRequest(details));

        assertThat(result.createdCustomer()).isFalse();
        assertThat(result.customer().getTotalVisits()).isEqualTo(2);
        assertThat(result.vehicleIfPresent()).contains(vehicle);
        verify(visitTracker, times(1)).recordVisit(any());
    }

    @Test
    void orderFailureIsReportedWithItsStep() {
        runCallbacksInline();
        when(customerResolver.resolveInCurrentTransaction(JANE, true)).thenReturn(CustomerResolution.created(jane));
        when(orderCreator.create(any(), any(), any(), any(), any()))
                .thenThrow(new IllegalStateException("almacén no disponible"));

        assertThatThrownBy(() -> coordinator.createCompleteFlow(janeRequest(null)))
                .isInstanceOf(FlowFailureException.class)
                .hasFieldOrPropertyWithValue("step", FlowStep.ORDER)
                .hasCauseInstanceOf(IllegalStateException.class);
        verify(visitTracker, never()).recordVisit(any());
    }

    @Test
    void customerConflictRerunsUnitInRereadMode() {
        runCallbacksInline();
        when(customerResolver.resolveInCurrentTransaction(JANE, true))
                .thenThrow(IdentityConflictException.customer(JANE, null));
        when(customerResolver.resolveInCurrentTransaction(JANE, false)).thenReturn(CustomerResolution.existing(jane));
        when(orderCreator.create(any(), any(), any(), any(), any())).thenReturn(order);
        when(visitTracker.recordVisit(jane)).thenReturn(jane.toBuilder().totalVisits(2).build());

        FlowResult result = coordinator.createCompleteFlow(janeRequest(null));

        assertThat(result.createdCustomer()).isFalse();
        verify(transactionTemplate, times(2)).execute(any());
        verify(orderCreator, times(1)).create(any(), any(), any(), any(), any());
        verify(visitTracker, times(1)).recordVisit(any());
    }

    @Test
    void repeatedConflictSurfacesResolutionFailure() {
        runCallbacksInline();
        VehicleDetails details = VehicleDetails.builder().plate("AB123CD").build();
        when(customerResolver.resolveInCurrentTransaction(any(), anyBoolean()))
                .thenReturn(CustomerResolution.existing(jane));
        when(vehicleResolver.resolveOrCreate(jane, details))
                .thenThrow(IdentityConflictException.vehicle(1L, "AB123CD", null));

        assertThatThrownBy(() -> coordinator.createCompleteFlow(janeRequest(details)))
                .isInstanceOf(ResolutionFailureException.class);
        verify(orderCreator, never()).create(any(), any(), any(), any(), any());
    }

    @Test
    void unidentifiedWalkInResolvesThroughFallbackIdentity() {
        runCallbacksInline();
        IdentityKey fallback = new IdentityKey(2, "Walk-in QCK-J-77", "", "", "");
        when(customerResolver.resolveInCurrentTransaction(fallback, true)).thenReturn(CustomerResolution.created(jane));
        when(orderCreator.create(any(), any(), any(), any(), any())).thenReturn(order);

        coordinator.createCompleteFlow(FlowRequest.builder()
                .channel(IntakeChannel.QUICK_CREATE)
                .customer(CandidateIdentity.builder().branch(2).sourceReference("J-77").build())
                .order(OrderDetails.builder().type(OrderType.INQUIRY).build())
                .build());

        verify(customerResolver).resolveInCurrentTransaction(fallback, true);
    }

    @Test
    void invalidIdentityNeverOpensTransaction() {
        FlowRequest request = FlowRequest.builder()
                .channel(IntakeChannel.INVOICE_CAPTURE)
                .customer(CandidateIdentity.builder().branch(1).build())
                .order(OrderDetails.builder().type(OrderType.SALES).build())
                .build();

        assertThatThrownBy(() -> coordinator.createCompleteFlow(request))
                .isInstanceOf(IdentityValidationException.class);
        verifyNoInteractions(transactionTemplate, customerResolver);
    }

    @Test
    void cancellationBeforeCommitRollsBack() {
        runCallbacksInline();
        when(customerResolver.resolveInCurrentTransaction(JANE, true)).thenReturn(CustomerResolution.created(jane));
        when(orderCreator.create(any(), any(), any(), any(), any())).thenReturn(order);

        Thread.currentThread().interrupt();
        try {
            assertThatThrownBy(() -> coordinator.createCompleteFlow(janeRequest(null)))
                    .isInstanceOf(FlowFailureException.class)
                    .hasFieldOrPropertyWithValue("step", FlowStep.COMMIT);
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void orderWithoutTypeIsRejectedBeforeOpeningTransaction() {
        FlowRequest request = janeRequest(null);
        request.setOrder(new OrderDetails());
        doThrow(IdentityValidationException.missingOrderType())
                .when(orderCreator).validate(request.getOrder(), "ORD-9");

        assertThatThrownBy(() -> coordinator.createCompleteFlow(request))
                .isInstanceOf(IdentityValidationException.class)
                .hasMessageContaining("tipo");
        verifyNoInteractions(transactionTemplate, customerResolver);
    }

    @Test
    void overlongVehicleIsRejectedBeforeOpeningTransaction() {
        VehicleDetails details = VehicleDetails.builder().plate("P".repeat(25)).build();
        doThrow(IdentityValidationException.tooLong("plate", VehicleResolver.MAX_PLATE_LENGTH))
                .when(vehicleResolver).validate(details);

        assertThatThrownBy(() -> coordinator.createCompleteFlow(janeRequest(details)))
                .isInstanceOf(IdentityValidationException.class)
                .hasMessageContaining("plate");
        verifyNoInteractions(transactionTemplate, customerResolver);
        verify(orderCreator, never()).validate(any(), any());
    }
}
