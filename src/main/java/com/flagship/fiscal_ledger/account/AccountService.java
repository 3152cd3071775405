package com.flagship.fiscal_ledger.account;

import com.flagship.fiscal_ledger.exception.ConflictException;
import com.flagship.fiscal_ledger.exception.NotFoundException;
import com.flagship.fiscal_ledger.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Account directory. Bridges the {@link Account} domain type and {@link AccountEntity}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountService {

    private final AccountRepository accountRepository;

    @Transactional
    public Account create(UUID tenantId, String code, String name, AccountType type,
                          UUID parentId, String description) {
        Account account = Account.create(tenantId, code, name, type, parentId, description);

        if (parentId != null && !accountRepository.existsByIdAndTenantId(parentId, tenantId)) {
            throw NotFoundException.of("Parent account", parentId);
        }
        if (accountRepository.findByTenantIdAndCode(tenantId, account.getCode()).isPresent()) {
            throw new ConflictException("Account code already exists: " + account.getCode());
        }

        try {
            AccountEntity saved = accountRepository.saveAndFlush(AccountEntity.fromDomain(account));
            CorrelationContext.putId(CorrelationContext.ACCOUNT_ID_MDC_KEY, saved.getId());
            log.info("Created account {} ({}, {})", saved.getCode(), saved.getName(), saved.getType());
            return saved.toDomain();
        } catch (DataIntegrityViolationException e) {
            throw new ConflictException("Account code already exists: " + account.getCode(), e);
        } finally {
            CorrelationContext.clearDomainIds();
        }
    }

    @Transactional(readOnly = true)
    public Account get(UUID tenantId, UUID accountId) {
        return accountRepository.findByIdAndTenantId(accountId, tenantId)
            .map(AccountEntity::toDomain)
            .orElseThrow(() -> NotFoundException.of("Account", accountId));
    }

    @Transactional(readOnly = true)
    public List<Account> listForTenant(UUID tenantId) {
        return accountRepository.findByTenantIdOrderByCodeAsc(tenantId).stream()
            .map(AccountEntity::toDomain)
            .toList();
    }

    /**
     * Updates name, description and active flag. Code and type never change
     * once lines may reference the account.
     */
    @Transactional
    public Account update(UUID tenantId, UUID accountId, String name, String description, boolean active) {
        AccountEntity existing = accountRepository.findByIdAndTenantId(accountId, tenantId)
            .orElseThrow(() -> NotFoundException.of("Account", accountId));

        existing.updateFromDomain(existing.toDomain().withDetails(name, description, active));
        AccountEntity updated = accountRepository.saveAndFlush(existing);
        log.debug("Updated account {}", updated.getCode());
        return updated.toDomain();
    }

    @Transactional(readOnly = true)
    public boolean exists(UUID tenantId, UUID accountId) {
        return accountRepository.existsByIdAndTenantId(accountId, tenantId);
    }

    /**
     * @throws NotFoundException naming the first account that does not exist for the tenant
     */
    @Transactional(readOnly = true)
    public void requireAllExist(UUID tenantId, Collection<UUID> accountIds) {
        Set<UUID> wanted = new HashSet<>(accountIds);
        if (wanted.isEmpty()) {
            return;
        }
        Set<UUID> found = new HashSet<>(accountRepository.findExistingIds(tenantId, wanted));
        for (UUID accountId : accountIds) {
            if (!found.contains(accountId)) {
                throw NotFoundException.of("Account", accountId);
            }
        }
    }
}
