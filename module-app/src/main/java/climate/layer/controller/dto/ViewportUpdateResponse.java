package climate.layer.controller.dto;

/** @param refetch 레이어를 다시 요청해야 하는지 여부 */
public record ViewportUpdateResponse(boolean refetch) {}
