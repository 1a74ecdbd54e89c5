package com.example.todos.service;

import com.example.todos.domain.entity.User;
import com.example.todos.exception.Outcome;
import com.example.todos.repository.UserRepository;
import com.example.todos.security.CredentialVerifier;
import com.example.todos.security.TokenCodec;
import com.example.todos.util.ValidationMessages;
import jakarta.validation.Validator;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Login and signup.
 *
 * <p>Login verifies credentials and mints a token for the user. Signup validates and stores a new
 * account, then logs it in with the same credentials, so a freshly returned token is always
 * decodable to the new user's id.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthenticationService {

  static final String EMAIL_TAKEN = "Email has already been taken";

  // bcrypt ignores anything past 72 bytes
  private static final int MAX_PASSWORD_BYTES = 72;

  private final CredentialVerifier credentialVerifier;
  private final TokenCodec tokenCodec;
  private final UserRepository userRepository;
  private final PasswordEncoder passwordEncoder;
  private final Validator validator;

  public Outcome<String> login(String email, String password) {
    return credentialVerifier.verify(email, password)
        .map(user -> {
          log.info("User {} logged in", user.getId());
          return tokenCodec.encode(user.getId());
        });
  }

  /**
   * Creates an account and logs it in.
   *
   * @param passwordConfirmation checked against {@code password} only when present
   */
  public Outcome<SignupResult> signup(String name,
                                      String email,
                                      String password,
                                      String passwordConfirmation) {
    List<String> errors = new ArrayList<>();

    if (!StringUtils.hasText(password)) {
      errors.add("Password can't be blank");
    } else if (password.getBytes(StandardCharsets.UTF_8).length > MAX_PASSWORD_BYTES) {
      errors.add("Password is too long (maximum is %d bytes)".formatted(MAX_PASSWORD_BYTES));
    }
    if (passwordConfirmation != null && !passwordConfirmation.equals(password)) {
      errors.add("Password confirmation doesn't match Password");
    }
    errors.addAll(ValidationMessages.describeAll(validator.validateValue(User.class, "name", name)));
    errors.addAll(ValidationMessages.describeAll(validator.validateValue(User.class, "email", email)));
    if (StringUtils.hasText(email) && userRepository.existsByEmail(email)) {
      errors.add(EMAIL_TAKEN);
    }

    if (!errors.isEmpty()) {
      log.debug("Signup rejected: {}", errors);
      return ValidationMessages.failure(errors);
    }

    User user;
    try {
      user = userRepository.saveAndFlush(new User(name, email, passwordEncoder.encode(password)));
    } catch (DataIntegrityViolationException e) {
      // lost a race with a concurrent signup for the same email
      log.debug("Signup for existing email rejected by constraint");
      return ValidationMessages.failure(EMAIL_TAKEN);
    }
    log.info("Created user {}", user.getId());

    return login(email, password).map(token -> new SignupResult(user, token));
  }
}
