package org.broadinstitute.goenrich.utils.config;

import java.lang.annotation.*;

/**
 * Marks an {@link org.aeonbits.owner.Config} option whose value is copied into the Java System Properties
 * by {@link ConfigFactory#injectSystemPropertiesFromConfig}.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
@Documented
public @interface SystemProperty {

}
