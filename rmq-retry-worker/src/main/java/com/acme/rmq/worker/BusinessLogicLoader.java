package com.acme.rmq.worker;

import com.acme.rmq.config.ConfigurationException;
import com.acme.rmq.spi.BusinessLogic;

/** Instantiates a {@link BusinessLogic} implementation by class name. */
public final class BusinessLogicLoader {

    private BusinessLogicLoader() {
    }

    /**
     * @param className fully-qualified name of a class with a public no-arg constructor
     * @throws ConfigurationException if the class is missing, of the wrong type or cannot be built
     */
    public static BusinessLogic load(String className) {
        Class<?> type;
        try {
            type = Class.forName(className);
        } catch (ClassNotFoundException e) {
            throw new ConfigurationException("Business logic class not found: " + className, e);
        }
        if (!BusinessLogic.class.isAssignableFrom(type)) {
            throw new ConfigurationException(
                    className + " does not implement " + BusinessLogic.class.getName());
        }
        try {
            return (BusinessLogic) type.getDeclaredConstructor().newInstance();
        } catch (ReflectiveOperationException e) {
            throw new ConfigurationException("Cannot instantiate business logic " + className, e);
        }
    }
}
