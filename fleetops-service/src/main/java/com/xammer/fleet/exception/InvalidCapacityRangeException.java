package com.xammer.fleet.exception;

public class InvalidCapacityRangeException extends InvalidConfigurationException {

    public InvalidCapacityRangeException(int minSize, int desiredCapacity, int maxSize) {
        super(String.format("capacity must satisfy minSize <= desiredCapacity <= maxSize (got min=%d, desired=%d, max=%d)",
                minSize, desiredCapacity, maxSize));
    }
}
