package matlabode;

/**
 * Serializes an {@link OdeModel} into a target format such as SBML or XPP.
 * Implementations live outside this library.
 */
public interface OdeModelEmitter {

    String emit(OdeModel model) throws OdeConversionException;
}
