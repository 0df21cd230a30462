package com.work.token.demo.web;

import com.work.token.core.model.TokenResult;
import com.work.token.demo.service.TokenVerificationService;
import com.work.token.demo.web.dto.TokenView;
import com.work.token.demo.web.dto.VerifyTokenRequest;
import com.work.token.demo.web.dto.VerifyTokenResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.servlet.http.HttpServletRequest;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 提供最小可用的 REST API，便于直接观察过滤器注入的 token 与校验元数据 token。
 */
@RestController
@RequestMapping("/api/tokens")
public class TokenController {

    private final TokenVerificationService verificationService;

    public TokenController(TokenVerificationService verificationService) {
        this.verificationService = verificationService;
    }

    /**
     * 返回本次请求本身生成的 token（失败项不返回）。
     */
    @GetMapping
    public ResponseEntity<List<TokenView>> current(HttpServletRequest request) {
        return ResponseEntity.ok(toViews(request.getAttribute(TokenInjectionFilter.RESULTS_ATTRIBUTE)));
    }

    @PostMapping("/verify")
    public ResponseEntity<VerifyTokenResponse> verify(@Validated @RequestBody VerifyTokenRequest request) {
        return ResponseEntity.ok(verificationService.verify(request.getPath(), request.getName(), request.getToken()));
    }

    private static List<TokenView> toViews(Object attribute) {
        if (!(attribute instanceof List)) {
            return Collections.emptyList();
        }
        List<TokenView> views = new ArrayList<>();
        for (Object o : (List<?>) attribute) {
            if (o instanceof TokenResult && ((TokenResult) o).isSuccess()) {
                views.add(TokenView.from((TokenResult) o));
            }
        }
        return views;
    }
}
