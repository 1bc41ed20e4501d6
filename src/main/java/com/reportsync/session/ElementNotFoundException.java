package com.reportsync.session;

import com.reportsync.core.DriverException;

public class ElementNotFoundException extends DriverException {

    public ElementNotFoundException(String selector) {
        super("element not found: " + selector);
    }
}
