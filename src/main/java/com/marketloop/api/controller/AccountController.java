package com.marketloop.api.controller;

import com.marketloop.domain.model.AccountBalance;
import com.marketloop.exchange.ExchangeGateway;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Exchange account reads. Exchange failures surface as 502/503 through the exception handler. */
@RestController
@RequestMapping("/api/account")
public class AccountController {

    private final ExchangeGateway exchangeGateway;

    public AccountController(ExchangeGateway exchangeGateway) {
        this.exchangeGateway = exchangeGateway;
    }

    @GetMapping("/balance")
    public ResponseEntity<AccountBalance> balance() {
        return ResponseEntity.ok(exchangeGateway.balance());
    }
}
