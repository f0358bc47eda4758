package uk.gegc.gosuraksha.features.account.domain.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;
import uk.gegc.gosuraksha.shared.exception.ResourceNotFoundException;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class AccountNotFoundException extends ResourceNotFoundException {
    public AccountNotFoundException(String accountRef) {
        super("Account " + accountRef + " not found");
    }
}
