package com.portfolioengine.exception;

/**
 * Input that cannot be used for arithmetic, such as a zero price or zero balance.
 */
public class DegenerateInputException extends BaseException {

    public DegenerateInputException(String message) {
        super(ErrorCode.DEGENERATE_INPUT, message);
    }
}
