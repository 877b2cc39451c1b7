package com.threadgraph.integration.contract;

import com.threadgraph.integration.enumerations.ThreadGraphHttpStatus;

public interface IThreadGraphErrorInfo {
    String getErrorCode();
    ThreadGraphHttpStatus getHttpStatus();
    String getErrorTemplate();
    String getResolutionTemplate();
}
