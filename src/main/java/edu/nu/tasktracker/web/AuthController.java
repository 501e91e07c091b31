package edu.nu.tasktracker.web;

import edu.nu.tasktracker.dto.*;
import edu.nu.tasktracker.service.AuthService;
import edu.nu.tasktracker.service.AuthService.AuthenticatedUser;
import edu.nu.tasktracker.service.CallerContext;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/auth")
public class AuthController {
    private final AuthService auth;

    public AuthController(AuthService auth) {
        this.auth = auth;
    }

    /**
     * Creates the account and signs the new user in straight away.
     */
    @PostMapping("/register")
    public ResponseEntity<AuthResponse> register(@Valid @RequestBody RegisterRequest req) {
        AuthenticatedUser result = auth.register(req);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(DTOMapper.toAuthResponse(result.getUser(), result.getTokens()));
    }

    @PostMapping("/login")
    public ResponseEntity<AuthResponse> login(@Valid @RequestBody LoginRequest req) {
        AuthenticatedUser result = auth.login(req.getEmail(), req.getPassword());
        return ResponseEntity.ok(DTOMapper.toAuthResponse(result.getUser(), result.getTokens()));
    }

    @PostMapping("/refresh")
    public ResponseEntity<TokenPair> refresh(@Valid @RequestBody RefreshRequest req) {
        return ResponseEntity.ok(auth.refresh(req.getRefresh()));
    }

    @GetMapping("/profile")
    public ResponseEntity<UserResponseDTO> profile(@AuthenticationPrincipal CallerContext caller) {
        return ResponseEntity.ok(DTOMapper.toUserDTO(auth.profile(caller)));
    }
}
