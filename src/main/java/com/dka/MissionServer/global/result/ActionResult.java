package com.dka.MissionServer.global.result;

import com.dka.MissionServer.global.constant.ErrorCode;
import lombok.Getter;

/**
 * 방 상태 변경 요청의 처리 결과.
 * 클라이언트에게 아무것도 보내지 않는 경우에도 호출 측이 로그를 남길 수 있도록 사유를 담는다.
 */
@Getter
public class ActionResult {

    private static final ActionResult SUCCESS = new ActionResult(Status.SUCCESS, null);

    private final Status status;
    private final ErrorCode errorCode;

    public enum Status {
        SUCCESS,   // 상태 변경 완료
        REJECTED,  // 요청자에게 error_msg 전송 후 거절
        IGNORED    // 응답 없이 무시 (권한 없음, 대상 없음 등)
    }

    private ActionResult(Status status, ErrorCode errorCode) {
        this.status = status;
        this.errorCode = errorCode;
    }

    public static ActionResult success() {
        return SUCCESS;
    }

    public static ActionResult rejected(ErrorCode errorCode) {
        return new ActionResult(Status.REJECTED, errorCode);
    }

    public static ActionResult ignored(ErrorCode errorCode) {
        return new ActionResult(Status.IGNORED, errorCode);
    }

    public boolean isSuccess() { return status == Status.SUCCESS; }
    public boolean isRejected() { return status == Status.REJECTED; }
    public boolean isIgnored() { return status == Status.IGNORED; }

    @Override
    public String toString() {
        return errorCode == null ? status.name() : status.name() + "(" + errorCode.name() + ")";
    }
}
