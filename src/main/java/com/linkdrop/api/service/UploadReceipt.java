package com.linkdrop.api.service;

import com.linkdrop.api.model.ShareRecord;
import lombok.Value;

@Value
public class UploadReceipt {
    String uploadId;
    ShareRecord share;
}
