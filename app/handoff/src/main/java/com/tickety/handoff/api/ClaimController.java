/*
 * Where: handoff API
 * What: the receiving party's claim and recipient lookup endpoints
 * Why: the recipient side of a handoff has no pending operation of its own to act on
 */
package com.tickety.handoff.api;

import com.tickety.handoff.config.RequestMdcInterceptor;
import com.tickety.handoff.service.ClaimResult;
import com.tickety.handoff.service.ClaimService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/claims")
@RequiredArgsConstructor
@Validated
public class ClaimController {

  private final ClaimService claimService;

  @PostMapping
  public ResponseEntity<ClaimResponse> claim(
      @RequestHeader(RequestMdcInterceptor.HEADER_ACTOR_ID)
          @NotBlank(message = "X-Actor-Id is required")
          String actorId,
      @Valid @RequestBody ClaimRequest request) {
    final ClaimResult result = claimService.claimByToken(request.transferToken(), actorId);
    return ResponseEntity.status(statusOf(result.status())).body(ClaimResponse.from(result));
  }

  @PostMapping("/email-lookup")
  public EmailLookupResponse lookup(
      @RequestHeader(RequestMdcInterceptor.HEADER_ACTOR_ID)
          @NotBlank(message = "X-Actor-Id is required")
          String actorId,
      @Valid @RequestBody EmailLookupRequest request) {
    return EmailLookupResponse.from(claimService.claimByEmailLookup(request.email()));
  }

  static HttpStatus statusOf(ClaimResult.Status status) {
    return switch (status) {
      case CLAIMED -> HttpStatus.OK;
      case NOT_FOUND -> HttpStatus.NOT_FOUND;
      case EXPIRED -> HttpStatus.GONE;
      case ALREADY_REDEEMED, REVOKED, OPERATION_CANCELLED, SELF_TRANSFER -> HttpStatus.CONFLICT;
      case NOT_OWNER, NOT_AUTHORIZED -> HttpStatus.FORBIDDEN;
    };
  }
}
