package dev.mars.mq.api.error;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

/**
 * Standard error codes for the MQ client.
 * 
 * Error code ranges:
 * - MQERR0001-0049: General/System errors
 * - MQERR0050-0099: Publish errors
 * - MQERR0100-0149: Consumption errors
 * - MQERR0150-0199: Acknowledgement errors
 * - MQERR0200-0249: Transaction errors
 * - MQERR0250-0299: Broker/Registry errors
 * - MQERR0300-0349: Connection errors
 * - MQERR0350-0399: Codec errors
 */
public final class MqErrorCodes {

    private MqErrorCodes() {
        // Utility class - no instantiation
    }

    // ========================================================================
    // General/System Errors (0001-0049)
    // ========================================================================
    public static final String INTERNAL_ERROR = "MQERR0001";
    public static final String INTERRUPTED = "MQERR0002";
    public static final String INVALID_OPERATION = "MQERR0003";

    // ========================================================================
    // Publish Errors (0050-0099)
    // ========================================================================
    public static final String EMPTY_JOB = "MQERR0050";
    public static final String PUBLISH_FAILED = "MQERR0051";
    public static final String REPUBLISH_FAILED = "MQERR0052";

    // ========================================================================
    // Consumption Errors (0100-0149)
    // ========================================================================
    public static final String ALREADY_CLOSED = "MQERR0100";
    public static final String END_OF_STREAM = "MQERR0101";
    public static final String CONSUME_FAILED = "MQERR0102";

    // ========================================================================
    // Acknowledgement Errors (0150-0199)
    // ========================================================================
    public static final String CANNOT_ACKNOWLEDGE = "MQERR0150";
    public static final String ACKNOWLEDGE_FAILED = "MQERR0151";

    // ========================================================================
    // Transaction Errors (0200-0249)
    // ========================================================================
    public static final String TRANSACTIONS_NOT_SUPPORTED = "MQERR0200";
    public static final String TRANSACTION_FAILED = "MQERR0201";

    // ========================================================================
    // Broker/Registry Errors (0250-0299)
    // ========================================================================
    public static final String UNSUPPORTED_SCHEME = "MQERR0250";
    public static final String BROKER_CREATE_FAILED = "MQERR0251";
    public static final String QUEUE_DECLARE_FAILED = "MQERR0252";

    // ========================================================================
    // Connection Errors (0300-0349)
    // ========================================================================
    public static final String CONNECTION_LOST = "MQERR0300";
    public static final String RECONNECT_FAILED = "MQERR0301";

    // ========================================================================
    // Codec Errors (0350-0399)
    // ========================================================================
    public static final String UNKNOWN_CONTENT_TYPE = "MQERR0350";
    public static final String ENCODE_FAILED = "MQERR0351";
    public static final String DECODE_FAILED = "MQERR0352";
}
