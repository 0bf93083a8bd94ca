package uk.gegc.ergtracker.features.account.infra.mapping;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.ergtracker.features.account.api.dto.AccountDto;
import uk.gegc.ergtracker.features.account.domain.model.Account;
import uk.gegc.ergtracker.features.account.domain.service.CategoryCalculator;

import java.time.Clock;
import java.time.Year;
import java.util.List;

@Component
@RequiredArgsConstructor
public class AccountMapper {

    private final CategoryCalculator categoryCalculator;
    private final Clock clock;

    public AccountDto toDto(Account account) {
        return new AccountDto(
                account.getId(),
                account.getEmail(),
                account.getName(),
                account.getRole(),
                account.getStatus(),
                List.copyOf(account.getSocietyIds()),
                account.getPrimarySocietyId(),
                account.getBirthYear(),
                category(account.getBirthYear()),
                account.getWeight(),
                account.getHeight(),
                account.getDesignatedCoachId(),
                account.getCreatedAt()
        );
    }

    /** Derived for the current year; absent without a birth year, matching the stored column. */
    private String category(Integer birthYear) {
        if (birthYear == null) {
            return null;
        }
        return categoryCalculator.label(birthYear, Year.now(clock).getValue());
    }
}
