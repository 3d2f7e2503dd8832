package com.flagship.mill_sync.customer;

import com.flagship.mill_sync.common.LedgerRecord;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Table;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Customer ledger row.
 *
 * Balance sign: positive means the customer owes the mill, negative means
 * the mill owes the customer.
 */
@Entity
@Table(name = "customers")
@Getter
public class CustomerEntity extends LedgerRecord {

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    @Column(name = "phone", nullable = false, length = 32)
    private String phone;

    @Column(name = "secondary_phone", length = 32)
    private String secondaryPhone;

    @Column(name = "address", length = 500)
    private String address;

    @Column(name = "nic_number", length = 32)
    private String nicNumber;

    @Enumerated(EnumType.STRING)
    @Column(name = "customer_type", nullable = false, length = 16)
    private CustomerType customerType;

    @Column(name = "total_purchases", nullable = false, precision = 19, scale = 2)
    private BigDecimal totalPurchases = BigDecimal.ZERO;

    @Column(name = "total_sales", nullable = false, precision = 19, scale = 2)
    private BigDecimal totalSales = BigDecimal.ZERO;

    @Column(name = "balance", nullable = false, precision = 19, scale = 2)
    private BigDecimal balance = BigDecimal.ZERO;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    protected CustomerEntity() {
        // JPA
    }

    public CustomerEntity(long localId, Instant now, CustomerDetails details) {
        super(localId, now);
        applyDetails(details);
    }

    public void updateDetails(CustomerDetails details, Instant now) {
        applyDetails(details);
        touch(now);
    }

    /**
     * A purchase from this customer: the mill owes them whatever stays unpaid.
     */
    public void recordPurchase(BigDecimal total, BigDecimal due, Instant now) {
        this.totalPurchases = totalPurchases.add(total);
        this.balance = balance.subtract(due);
        touch(now);
    }

    /**
     * A sale to this customer: they owe the mill whatever stays unpaid.
     */
    public void recordSale(BigDecimal total, BigDecimal due, Instant now) {
        this.totalSales = totalSales.add(total);
        this.balance = balance.add(due);
        touch(now);
    }

    public void reversePurchase(BigDecimal total, BigDecimal due, Instant now) {
        this.totalPurchases = totalPurchases.subtract(total);
        this.balance = balance.add(due);
        touch(now);
    }

    public void reverseSale(BigDecimal total, BigDecimal due, Instant now) {
        this.totalSales = totalSales.subtract(total);
        this.balance = balance.subtract(due);
        touch(now);
    }

    /**
     * Settles part of an open balance. The balance moves towards zero from
     * whichever side it is on.
     */
    public void applySettlement(BigDecimal amount, boolean millPaysCustomer, Instant now) {
        this.balance = millPaysCustomer ? balance.add(amount) : balance.subtract(amount);
        touch(now);
    }

    /**
     * Overwrites descriptive fields with the remote version.
     */
    public void applyRemote(CustomerDetails details, BigDecimal remoteBalance, Instant remoteUpdatedAt, Instant now) {
        applyDetails(details);
        if (remoteBalance != null) {
            this.balance = remoteBalance;
        }
        acceptRemote(remoteUpdatedAt, now);
    }

    private void applyDetails(CustomerDetails details) {
        this.name = details.getName();
        this.phone = details.getPhone();
        this.secondaryPhone = details.getSecondaryPhone();
        this.address = details.getAddress();
        this.nicNumber = details.getNicNumber();
        this.customerType = details.getCustomerType() != null ? details.getCustomerType() : CustomerType.OTHER;
        this.active = details.isActive();
    }
}
