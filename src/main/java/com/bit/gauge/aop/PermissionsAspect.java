package com.bit.gauge.aop;

import com.bit.gauge.common.AccountAddress;
import com.bit.gauge.config.SystemConfig;
import com.bit.gauge.exception.ErrorType;
import com.bit.gauge.exception.GaugeException;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.annotation.Pointcut;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.lang.reflect.Method;

@Slf4j
@Aspect
@Component
public class PermissionsAspect {

    @Autowired
    private SystemConfig config;

    /**
     * 设置切入点 在注解的位置切入代码
     */
    @Pointcut("@annotation(com.bit.gauge.aop.annotation.PermissionsAnnotation)")
    public void PermissionsPointCut() {}


    @Around(value = "PermissionsPointCut()")
    public Object around(ProceedingJoinPoint pjp) throws Throwable {
        MethodSignature signature = (MethodSignature) pjp.getSignature();
        Method method = signature.getMethod();
        AccountAddress caller = null;
        for (Object arg : pjp.getArgs()) {
            if (arg instanceof AccountAddress) {
                caller = (AccountAddress) arg;
                break;
            }
        }
        AccountAddress governor = config.governorAddress();
        if (caller == null || !caller.equals(governor)) {
            log.warn("拒绝调用 {}：调用者 {} 不是治理者", method.getName(), caller);
            throw new GaugeException(ErrorType.PERMISSION_DENIED, method.getName() + " caller=" + caller);
        }
        return pjp.proceed();
    }
}
