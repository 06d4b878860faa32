package climate.layer.error.exception;

import climate.layer.error.CommonErrorCode;
import climate.layer.error.exception.base.ClientBaseException;
import lombok.Getter;

@Getter
public class UnknownLayerException extends ClientBaseException {

  private final String layerId;

  public UnknownLayerException(String layerId) {
    super(CommonErrorCode.UNKNOWN_LAYER, layerId);
    this.layerId = layerId;
  }
}
