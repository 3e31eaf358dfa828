package com.tripplanner.routing.error;

import com.tripplanner.routing.model.Provider;

public class QuotaExceededException extends ProviderException {

    public QuotaExceededException(Provider provider, String message) {
        super(provider, message);
    }
}
