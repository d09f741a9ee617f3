package com.plantops.qms.lifecycle.integration.contract;

import com.plantops.qms.lifecycle.integration.enumerations.QmsHttpStatus;

public interface IQmsErrorInfo {
    String getErrorCode();
    QmsHttpStatus getHttpStatus();
    String getErrorTemplate();
    String getResolutionTemplate();
}
