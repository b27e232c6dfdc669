package com.shareplan.domain.exception;

public interface Errors {

    interface ReferencePoints {
        String errorCode = "01";

        Error INVALID_INPUT = new Error(errorCode + "01");
        Error OVERSELL = new Error(errorCode + "02");
    }

    interface Calculation {
        String errorCode = "02";

        Error INVALID_INPUT = new Error(errorCode + "01");
        Error MISSING_DATA = new Error(errorCode + "02");
    }

    interface Currency {
        String errorCode = "03";

        Error INVALID_INPUT = new Error(errorCode + "01");
    }

    interface PriceHistory {
        String errorCode = "04";

        Error INVALID_INPUT = new Error(errorCode + "01");
        Error PERSISTENCE_ERROR = new Error(errorCode + "02");
    }

    interface Session {
        String errorCode = "05";

        Error INVALID_INPUT = new Error(errorCode + "01");
        Error NOT_FOUND = new Error(errorCode + "02");
        Error UNEXPECTED_ERROR = new Error(errorCode + "03");
    }

}
