package uk.gegc.ergtracker.features.account.application;

import org.springframework.security.core.Authentication;
import uk.gegc.ergtracker.features.account.api.dto.AccountDto;
import uk.gegc.ergtracker.features.account.api.dto.CategoryRecomputeResponse;

import java.util.List;
import java.util.UUID;

public interface AccountService {

    List<AccountDto> listAccounts(Authentication authentication);

    List<AccountDto> listPending(Authentication authentication);

    AccountDto getAccount(Authentication authentication, UUID accountId);

    AccountDto approve(Authentication authentication, UUID accountId);

    AccountDto reject(Authentication authentication, UUID accountId);

    AccountDto setDesignatedCoach(Authentication authentication, UUID accountId, UUID coachId);

    CategoryRecomputeResponse recomputeCategories(Authentication authentication);
}
