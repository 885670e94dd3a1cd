package com.conveyal.stopboard.error;

import java.util.Collection;

public class UnknownCityException extends Exception {
    public UnknownCityException(String city, Collection<String> knownCities) {
        super(String.format("Unknown city: %s. Available: %s", city, String.join(", ", knownCities)));
    }
}
