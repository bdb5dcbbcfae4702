package com.example.screenrelay.support;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import jakarta.validation.executable.ExecutableValidator;
import jakarta.validation.metadata.BeanDescriptor;

import java.util.Set;

/**
 * Delegating validator that runs a hook once, before the next bean is validated. Lets a test
 * interleave work with a request that already passed the connection check.
 */
public class HookedValidator implements Validator {
    private final Validator delegate;
    private Runnable hook;

    public HookedValidator(Validator delegate) {
        this.delegate = delegate;
    }

    public void beforeNextValidation(Runnable hook) {
        this.hook = hook;
    }

    @Override
    public <T> Set<ConstraintViolation<T>> validate(T object, Class<?>... groups) {
        Runnable pending = hook;
        hook = null;
        if (pending != null) {
            pending.run();
        }
        return delegate.validate(object, groups);
    }

    @Override
    public <T> Set<ConstraintViolation<T>> validateProperty(T object, String propertyName, Class<?>... groups) {
        return delegate.validateProperty(object, propertyName, groups);
    }

    @Override
    public <T> Set<ConstraintViolation<T>> validateValue(Class<T> beanType, String propertyName, Object value,
                                                        Class<?>... groups) {
        return delegate.validateValue(beanType, propertyName, value, groups);
    }

    @Override
    public BeanDescriptor getConstraintsForClass(Class<?> clazz) {
        return delegate.getConstraintsForClass(clazz);
    }

    @Override
    public <T> T unwrap(Class<T> type) {
        return delegate.unwrap(type);
    }

    @Override
    public ExecutableValidator forExecutables() {
        return delegate.forExecutables();
    }
}
