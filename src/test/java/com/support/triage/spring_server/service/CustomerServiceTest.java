package com.support.triage.spring_server.service;

import com.support.triage.spring_server.entity.Customer;
import com.support.triage.spring_server.entity.CustomerTier;
import com.support.triage.spring_server.exception.InvalidInputException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("CustomerService")
class CustomerServiceTest {

    @Mock
    private IssueStore issueStore;

    private CustomerService service;

    @BeforeEach
    void setUp() {
        service = new CustomerService(issueStore, Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    @DisplayName("new customer is stored with a normalised email and default tier")
    void createsCustomer() {
        when(issueStore.customerEmailExists("ada@acme.io")).thenReturn(false);
        when(issueStore.insertCustomer(any())).thenAnswer(inv -> {
            Customer c = inv.getArgument(0);
            c.setCustomerId("c-1");
            return c;
        });
        Customer request = new Customer();
        request.setCustomerName(" Ada ");
        request.setEmail(" Ada@Acme.io ");
        request.setTier(null);

        Customer created = service.createCustomer(request);

        assertThat(created.getCustomerId()).isEqualTo("c-1");
        assertThat(created.getCustomerName()).isEqualTo("Ada");
        assertThat(created.getEmail()).isEqualTo("ada@acme.io");
        assertThat(created.getTier()).isEqualTo(CustomerTier.BASIC);
        assertThat(created.getCreatedAt()).isNotNull();
    }

    @Test
    @DisplayName("duplicate email is rejected")
    void duplicateEmail() {
        when(issueStore.customerEmailExists("ada@acme.io")).thenReturn(true);
        Customer request = new Customer();
        request.setCustomerName("Ada");
        request.setEmail("ada@acme.io");

        assertThatThrownBy(() -> service.createCustomer(request)).isInstanceOf(InvalidInputException.class);
        verify(issueStore, never()).insertCustomer(any());
    }

    @Test
    @DisplayName("malformed email is rejected")
    void badEmail() {
        Customer request = new Customer();
        request.setCustomerName("Ada");
        request.setEmail("not-an-email");

        assertThatThrownBy(() -> service.createCustomer(request)).isInstanceOf(InvalidInputException.class);
    }
}
