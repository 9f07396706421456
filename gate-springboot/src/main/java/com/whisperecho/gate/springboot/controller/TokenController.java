package com.whisperecho.gate.springboot.controller;

import com.whisperecho.gate.model.PrincipalView;
import com.whisperecho.gate.model.TokenRequest;
import com.whisperecho.gate.model.TokenResponse;
import com.whisperecho.gate.server.manager.TokenService;
import com.whisperecho.gate.server.store.UserStoreException;
import java.util.function.Supplier;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

@RestController
@RequestMapping("/auth/token")
public class TokenController {

  private final TokenService tokenService;

  public TokenController(TokenService tokenService) {
    this.tokenService = tokenService;
  }

  @PostMapping("/verify")
  public PrincipalView verify(@RequestBody TokenRequest request) {
    return translate(() -> tokenService.verify(request.requireToken()));
  }

  @PostMapping("/refresh")
  public TokenResponse refresh(@RequestBody TokenRequest request) {
    return translate(() -> tokenService.refresh(request.requireToken()));
  }

  private static <T> T translate(Supplier<T> call) {
    try {
      return call.get();
    } catch (IllegalArgumentException e) {
      throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
    } catch (SecurityException e) {
      throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Invalid or expired token");
    } catch (UserStoreException e) {
      throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, "Authentication service error");
    } catch (IllegalStateException e) {
      throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "Authentication service unavailable");
    }
  }
}
