package com.bookshelf.backend.modules.authorization.presentation;

import com.bookshelf.backend.global.security.JwtAuthenticationPrincipal;
import com.bookshelf.backend.global.security.SecurityUtils;
import com.bookshelf.backend.modules.authorization.application.AuthorizationGate;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

@Component
public class PermissionInterceptor implements HandlerInterceptor {

    private final AuthorizationGate authorizationGate;

    public PermissionInterceptor(AuthorizationGate authorizationGate) {
        this.authorizationGate = authorizationGate;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (!(handler instanceof HandlerMethod handlerMethod)) {
            return true;
        }
        RequiresPermission required = resolve(handlerMethod);
        if (required == null) {
            return true;
        }
        Long actorId = SecurityUtils.findCurrentPrincipal()
                .map(JwtAuthenticationPrincipal::userId)
                .orElse(null);
        authorizationGate.require(actorId, required.value());
        return true;
    }

    private RequiresPermission resolve(HandlerMethod handlerMethod) {
        RequiresPermission onMethod = AnnotatedElementUtils.findMergedAnnotation(
                handlerMethod.getMethod(), RequiresPermission.class);
        if (onMethod != null) {
            return onMethod;
        }
        return AnnotatedElementUtils.findMergedAnnotation(handlerMethod.getBeanType(), RequiresPermission.class);
    }
}
