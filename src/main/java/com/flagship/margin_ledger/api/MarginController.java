package com.flagship.margin_ledger.api;

import com.flagship.margin_ledger.api.dto.AmountRequest;
import com.flagship.margin_ledger.api.dto.CloseResponse;
import com.flagship.margin_ledger.api.dto.CreateMarginAccountRequest;
import com.flagship.margin_ledger.api.dto.LiquidationResponse;
import com.flagship.margin_ledger.api.dto.MarginAccountResponse;
import com.flagship.margin_ledger.api.dto.OpenPositionRequest;
import com.flagship.margin_ledger.api.dto.OwnerRequest;
import com.flagship.margin_ledger.api.dto.PositionResponse;
import com.flagship.margin_ledger.api.dto.PriceUpdateRequest;
import com.flagship.margin_ledger.api.dto.RiskLimitsResponse;
import com.flagship.margin_ledger.api.dto.RiskScoreRequest;
import com.flagship.margin_ledger.external.ConfiguredPriceSource;
import com.flagship.margin_ledger.margin.LiquidationReason;
import com.flagship.margin_ledger.margin.MarginPositionService;
import com.flagship.margin_ledger.margin.PositionStatus;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * REST controller for margin accounts, positions, risk limits and mark prices.
 */
@RestController
@RequestMapping("/api/margin")
@RequiredArgsConstructor
@Slf4j
public class MarginController {

    private final MarginPositionService marginPositionService;
    private final ConfiguredPriceSource priceSource;

    @PostMapping("/accounts")
    public ResponseEntity<MarginAccountResponse> createAccount(@Valid @RequestBody CreateMarginAccountRequest request) {
        log.info("Received margin account request: user={}, tenant={}, broker={}, type={}",
                request.getUserId(), request.getTenantId(), request.getBrokerId(), request.getAccountType());
        var account = marginPositionService.createMarginAccount(request.getUserId(), request.getTenantId(),
                request.getBrokerId(), request.getAccountType(), request.getSymbol(), request.getInitialDeposit());
        return ResponseEntity.status(HttpStatus.CREATED).body(MarginAccountResponse.from(account));
    }

    @GetMapping("/accounts")
    public MarginAccountResponse findAccount(@RequestParam("user_id") String userId,
                                             @RequestParam("tenant_id") String tenantId,
                                             @RequestParam("broker_id") String brokerId) {
        return MarginAccountResponse.from(marginPositionService.getUserMarginAccount(userId, tenantId, brokerId));
    }

    @GetMapping("/accounts/{accountId}")
    public MarginAccountResponse getAccount(@PathVariable("accountId") String accountId) {
        return MarginAccountResponse.from(marginPositionService.getMarginAccount(accountId));
    }

    @PostMapping("/accounts/{accountId}/deposit")
    public MarginAccountResponse deposit(@PathVariable("accountId") String accountId,
                                         @Valid @RequestBody AmountRequest request) {
        return MarginAccountResponse.from(marginPositionService.depositMargin(accountId, request.getAmount()));
    }

    @PostMapping("/accounts/{accountId}/withdraw")
    public MarginAccountResponse withdraw(@PathVariable("accountId") String accountId,
                                          @Valid @RequestBody AmountRequest request) {
        return MarginAccountResponse.from(marginPositionService.withdrawMargin(accountId, request.getAmount()));
    }

    @PostMapping("/accounts/{accountId}/suspend")
    public MarginAccountResponse suspend(@PathVariable("accountId") String accountId) {
        return MarginAccountResponse.from(marginPositionService.suspendMarginAccount(accountId));
    }

    @PostMapping("/accounts/{accountId}/reactivate")
    public MarginAccountResponse reactivate(@PathVariable("accountId") String accountId) {
        return MarginAccountResponse.from(marginPositionService.reactivateMarginAccount(accountId));
    }

    @PostMapping("/accounts/{accountId}/close")
    public MarginAccountResponse close(@PathVariable("accountId") String accountId) {
        return MarginAccountResponse.from(marginPositionService.closeMarginAccount(accountId));
    }

    @GetMapping("/accounts/{accountId}/positions")
    public List<PositionResponse> listPositions(
            @PathVariable("accountId") String accountId,
            @RequestParam(value = "status", required = false) PositionStatus status) {
        return marginPositionService.getPositions(accountId, status).stream().map(PositionResponse::from).toList();
    }

    @GetMapping("/accounts/{accountId}/liquidations")
    public List<LiquidationResponse> listLiquidations(@PathVariable("accountId") String accountId) {
        return marginPositionService.getLiquidations(accountId).stream().map(LiquidationResponse::from).toList();
    }

    @PostMapping("/positions")
    public ResponseEntity<PositionResponse> openPosition(@Valid @RequestBody OpenPositionRequest request) {
        log.info("Received position request: account={}, symbol={}, side={}, size={}, leverage={}",
                request.getAccountId(), request.getSymbol(), request.getSide(), request.getSize(), request.getLeverage());
        var position = marginPositionService.createMarginPosition(request.toPositionRequest());
        return ResponseEntity.status(HttpStatus.CREATED).body(PositionResponse.from(position));
    }

    @GetMapping("/positions/{positionId}")
    public PositionResponse getPosition(@PathVariable("positionId") UUID positionId) {
        return PositionResponse.from(marginPositionService.getPosition(positionId));
    }

    @PostMapping("/positions/{positionId}/close")
    public CloseResponse closePosition(@PathVariable("positionId") UUID positionId,
                                       @Valid @RequestBody OwnerRequest owner) {
        return CloseResponse.from(marginPositionService.closeMarginPosition(
                owner.getUserId(), owner.getTenantId(), owner.getBrokerId(), positionId));
    }

    @PostMapping("/positions/{positionId}/liquidate")
    public LiquidationResponse liquidatePosition(
            @PathVariable("positionId") UUID positionId,
            @RequestParam(value = "reason", defaultValue = "FORCED_LIQUIDATION") LiquidationReason reason) {
        return LiquidationResponse.from(marginPositionService.liquidatePosition(positionId, reason));
    }

    @GetMapping("/risk-limits")
    public RiskLimitsResponse getRiskLimits(@RequestParam("user_id") String userId,
                                            @RequestParam("tenant_id") String tenantId,
                                            @RequestParam("broker_id") String brokerId) {
        return RiskLimitsResponse.from(marginPositionService.getRiskLimits(userId, tenantId, brokerId));
    }

    @PostMapping("/risk-score")
    public RiskLimitsResponse updateRiskScore(@Valid @RequestBody RiskScoreRequest request) {
        return RiskLimitsResponse.from(marginPositionService.updateUserRiskScore(
                request.getUserId(), request.getTenantId(), request.getBrokerId(), request.getRiskScore()));
    }

    @GetMapping("/prices")
    public Map<String, BigDecimal> getPrices() {
        return priceSource.snapshot();
    }

    /**
     * Sets a mark price and revalues the open positions in that symbol.
     */
    @PostMapping("/prices")
    public Map<String, Object> updatePrice(@Valid @RequestBody PriceUpdateRequest request) {
        priceSource.updatePrice(request.getSymbol(), request.getPrice());
        int changed = marginPositionService.markToMarket(request.getSymbol()).size();
        log.info("Mark price updated: symbol={}, price={}, accountsChanged={}",
                request.getSymbol(), request.getPrice(), changed);
        return Map.of("symbol", request.getSymbol(), "price", request.getPrice(), "accounts_changed", changed);
    }
}
