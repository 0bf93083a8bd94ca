package uk.gegc.ergtracker.features.account.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.security.core.Authentication;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.ergtracker.features.account.api.dto.AccountDto;
import uk.gegc.ergtracker.features.account.api.dto.CategoryRecomputeResponse;
import uk.gegc.ergtracker.features.account.application.AccountService;
import uk.gegc.ergtracker.features.account.application.RegistrationWorkflow;
import uk.gegc.ergtracker.features.account.domain.model.Account;
import uk.gegc.ergtracker.features.account.domain.model.AccountRole;
import uk.gegc.ergtracker.features.account.domain.repository.AccountRepository;
import uk.gegc.ergtracker.features.account.domain.service.CategoryCalculator;
import uk.gegc.ergtracker.features.account.infra.mapping.AccountMapper;
import uk.gegc.ergtracker.shared.exception.ResourceNotFoundException;
import uk.gegc.ergtracker.shared.exception.ValidationException;
import uk.gegc.ergtracker.shared.security.AccessControlEngine;
import uk.gegc.ergtracker.shared.security.CallerIdentity;
import uk.gegc.ergtracker.shared.security.CallerResolver;

import java.time.Clock;
import java.time.Year;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

@Service
@Transactional
@RequiredArgsConstructor
@Slf4j
public class AccountServiceImpl implements AccountService {

    private static final Sort BY_NAME = Sort.by(Sort.Direction.ASC, "name");

    private final AccountRepository accountRepository;
    private final AccountMapper accountMapper;
    private final AccessControlEngine accessControlEngine;
    private final CallerResolver callerResolver;
    private final RegistrationWorkflow registrationWorkflow;
    private final CategoryCalculator categoryCalculator;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public List<AccountDto> listAccounts(Authentication authentication) {
        CallerIdentity caller = callerResolver.resolve(authentication);
        return accountRepository.findAll(accessControlEngine.accountListing(caller).filterOrThrow(), BY_NAME)
                .stream()
                .map(accountMapper::toDto)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<AccountDto> listPending(Authentication authentication) {
        CallerIdentity caller = callerResolver.resolve(authentication);
        return accountRepository.findAll(accessControlEngine.pendingListing(caller).filterOrThrow(),
                        Sort.by(Sort.Direction.ASC, "createdAt"))
                .stream()
                .map(accountMapper::toDto)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public AccountDto getAccount(Authentication authentication, UUID accountId) {
        CallerIdentity caller = callerResolver.resolve(authentication);
        Account target = findAccount(accountId);
        accessControlEngine.requireViewAccount(caller, target);
        return accountMapper.toDto(target);
    }

    @Override
    public AccountDto approve(Authentication authentication, UUID accountId) {
        CallerIdentity caller = callerResolver.resolve(authentication);
        accessControlEngine.requireReviewAccount(caller, findAccount(accountId));
        return accountMapper.toDto(registrationWorkflow.approve(accountId));
    }

    @Override
    public AccountDto reject(Authentication authentication, UUID accountId) {
        CallerIdentity caller = callerResolver.resolve(authentication);
        accessControlEngine.requireReviewAccount(caller, findAccount(accountId));
        return accountMapper.toDto(registrationWorkflow.reject(accountId));
    }

    @Override
    public AccountDto setDesignatedCoach(Authentication authentication, UUID accountId, UUID coachId) {
        CallerIdentity caller = callerResolver.resolve(authentication);
        accessControlEngine.requireSuperAdmin(caller);

        Account target = findAccount(accountId);
        if (target.getRole() == AccountRole.ATHLETE) {
            throw new ValidationException("Designated coach can only be set on coach or super admin accounts");
        }
        if (coachId != null) {
            Account coach = findAccount(coachId);
            if (coach.getRole() != AccountRole.COACH) {
                throw new ValidationException("Designated account must be a coach");
            }
        }

        target.setDesignatedCoachId(coachId);
        log.info("Designated coach of account {} set to {}", accountId, coachId);
        return accountMapper.toDto(accountRepository.save(target));
    }

    @Override
    public CategoryRecomputeResponse recomputeCategories(Authentication authentication) {
        accessControlEngine.requireSuperAdmin(callerResolver.resolve(authentication));

        int currentYear = Year.now(clock).getValue();
        List<Account> accounts = accountRepository.findAllByBirthYearIsNotNull();
        int changed = 0;
        for (Account account : accounts) {
            String label = categoryCalculator.label(account.getBirthYear(), currentYear);
            if (!Objects.equals(label, account.getCategory())) {
                account.setCategory(label);
                changed++;
            }
        }
        if (changed > 0) {
            accountRepository.saveAll(accounts);
        }
        log.info("Category recompute examined {} accounts, changed {}", accounts.size(), changed);
        return new CategoryRecomputeResponse(accounts.size(), changed);
    }

    private Account findAccount(UUID accountId) {
        return accountRepository.findById(accountId)
                .orElseThrow(() -> new ResourceNotFoundException("Account " + accountId + " not found"));
    }
}
