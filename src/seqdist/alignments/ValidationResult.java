/*******************************************************************************
 * SeqDist - Pairwise alignments and evolutionary distances
 * Copyright 2026 SeqDist developers
 *
 * This file is part of SeqDist.
 *
 *     SeqDist is free software: you can redistribute it and/or modify
 *     it under the terms of the GNU General Public License as published by
 *     the Free Software Foundation, either version 3 of the License, or
 *     (at your option) any later version.
 *
 *     SeqDist is distributed in the hope that it will be useful,
 *     but WITHOUT ANY WARRANTY; without even the implied warranty of
 *     MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 *     GNU General Public License for more details.
 *
 *     You should have received a copy of the GNU General Public License
 *     along with SeqDist.  If not, see <http://www.gnu.org/licenses/>.
 *******************************************************************************/
package seqdist.alignments;

/**
 * Outcome of a validation or calculation over input data. Either holds a value or a MalformedInput error.
 * Operations returning this type report data problems by returning the error instead of throwing,
 * and composed operations forward the first error found to their own callers
 * @param <T> Type of the value obtained when the input is valid
 */
public final class ValidationResult<T> {
	private final T value;
	private final MalformedInput error;
	
	private ValidationResult(T value, MalformedInput error) {
		this.value = value;
		this.error = error;
	}
	
	public static <T> ValidationResult<T> success(T value) {
		if(value==null) throw new IllegalArgumentException("Successful results must have a value");
		return new ValidationResult<>(value, null);
	}
	
	public static <T> ValidationResult<T> malformedInput(String reason) {
		return new ValidationResult<>(null, new MalformedInput(reason));
	}
	
	/**
	 * Creates a failed result carrying the error of another failed result
	 * @param failed result with an error
	 * @return ValidationResult<T> result with the same error
	 */
	public static <T> ValidationResult<T> malformedInput(ValidationResult<?> failed) {
		if(failed.isValid()) throw new IllegalArgumentException("The given result does not have an error");
		return new ValidationResult<>(null, failed.getError());
	}
	
	public boolean isValid() {
		return error==null;
	}
	
	/**
	 * @return T value of a successful result
	 * @throws IllegalStateException If this result has an error
	 */
	public T getValue() {
		if(error!=null) throw new IllegalStateException("No value available. "+error.getMessage());
		return value;
	}
	
	/**
	 * @return MalformedInput error of a failed result or null if the result is valid
	 */
	public MalformedInput getError() {
		return error;
	}
	
	/**
	 * @return T value of a successful result
	 * @throws MalformedInputException If this result has an error
	 */
	public T getValueOrThrow() throws MalformedInputException {
		if(error!=null) throw new MalformedInputException(error);
		return value;
	}
	
	@Override
	public String toString() {
		if(error!=null) return error.getMessage();
		return String.valueOf(value);
	}
}
