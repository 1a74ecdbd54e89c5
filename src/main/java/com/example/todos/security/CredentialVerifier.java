package com.example.todos.security;

import com.example.todos.domain.entity.User;
import com.example.todos.exception.ErrorKind;
import com.example.todos.exception.Outcome;
import com.example.todos.repository.UserRepository;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Checks an email and password pair against the stored bcrypt digest.
 * Every failure cause yields the same {@link ErrorKind#AUTHENTICATION_FAILED}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CredentialVerifier {

  private final UserRepository userRepository;
  private final PasswordEncoder passwordEncoder;

  @Transactional(readOnly = true)
  public Outcome<User> verify(String email, String password) {
    if (email == null || password == null || password.isEmpty()) {
      return Outcome.failure(ErrorKind.AUTHENTICATION_FAILED);
    }

    Optional<User> user = userRepository.findByEmail(email);
    if (user.isEmpty() || !passwordEncoder.matches(password, user.get().getPasswordDigest())) {
      log.debug("Credential check failed");
      return Outcome.failure(ErrorKind.AUTHENTICATION_FAILED);
    }
    return Outcome.success(user.get());
  }
}
