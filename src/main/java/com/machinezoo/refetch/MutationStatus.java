// Part of Refetch
package com.machinezoo.refetch;

public enum MutationStatus {
	IDLE,
	MUTATING,
	SUCCESS,
	ERROR
}
